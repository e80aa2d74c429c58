package org.nowstart.tradeguard.service.auth;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;
import java.util.Locale;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import lombok.RequiredArgsConstructor;

/**
 * HMAC-SHA256 request signature over {@code timestamp + METHOD + pathWithQuery + body}, hex encoded.
 */
@RequiredArgsConstructor
public class GatewayRequestSigner {

    private static final String ALGORITHM = "HmacSHA256";

    private final String apiKey;
    private final String apiSecret;

    public boolean hasCredentials() {
        return apiKey != null && !apiKey.isBlank() && apiSecret != null && !apiSecret.isBlank();
    }

    public String apiKey() {
        return apiKey;
    }

    public String sign(long timestampMillis, String method, String pathWithQuery, String body) {
        String payload = timestampMillis + method.toUpperCase(Locale.ROOT) + pathWithQuery + (body == null ? "" : body);
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(apiSecret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign exchange gateway request", e);
        }
    }
}
