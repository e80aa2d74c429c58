package org.nowstart.tradeguard.service.auth;

import feign.RequestInterceptor;
import feign.RequestTemplate;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class GatewayAuthRequestInterceptor implements RequestInterceptor {

    public static final String API_KEY_HEADER = "X-API-KEY";
    public static final String TIMESTAMP_HEADER = "X-TIMESTAMP";
    public static final String SIGNATURE_HEADER = "X-SIGNATURE";

    private final GatewayRequestSigner gatewayRequestSigner;
    private final Clock clock;

    @Override
    public void apply(RequestTemplate template) {
        template.header("Accept", "application/json");
        template.header("User-Agent", "tradeguard/1.0");

        // market data endpoints work unsigned, e.g. in paper mode without credentials
        if (!gatewayRequestSigner.hasCredentials()) {
            return;
        }

        long timestamp = clock.millis();
        byte[] body = template.body();
        String bodyText = body == null ? "" : new String(body, StandardCharsets.UTF_8);
        String signature = gatewayRequestSigner.sign(timestamp, template.method(), template.url(), bodyText);

        template.header(API_KEY_HEADER, gatewayRequestSigner.apiKey());
        template.header(TIMESTAMP_HEADER, Long.toString(timestamp));
        template.header(SIGNATURE_HEADER, signature);
    }
}
