package org.nowstart.tradeguard.service.auth;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.junit.jupiter.api.Test;

class GatewayRequestSignerTest {

    @Test
    void sign_hmacOverTimestampMethodPathAndBody() {
        GatewayRequestSigner signer = new GatewayRequestSigner("key", "secret");

        String signature = signer.sign(1_700_000_000_000L, "post", "/v1/orders", "{\"symbol\":\"BTC-USD\"}");

        assertThat(signature).isEqualTo(hmacHex("secret", "1700000000000POST/v1/orders{\"symbol\":\"BTC-USD\"}"));
        assertThat(signature).hasSize(64).matches("[0-9a-f]+");
    }

    @Test
    void sign_nullBodySignsLikeEmptyBody() {
        GatewayRequestSigner signer = new GatewayRequestSigner("key", "secret");

        assertThat(signer.sign(1L, "GET", "/v1/balances", null)).isEqualTo(signer.sign(1L, "GET", "/v1/balances", ""));
    }

    @Test
    void sign_differentSecretsDiffer() {
        String first = new GatewayRequestSigner("key", "secret-a").sign(1L, "GET", "/v1/balances", "");
        String second = new GatewayRequestSigner("key", "secret-b").sign(1L, "GET", "/v1/balances", "");

        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void hasCredentials_requiresKeyAndSecret() {
        assertThat(new GatewayRequestSigner("key", "secret").hasCredentials()).isTrue();
        assertThat(new GatewayRequestSigner("", "secret").hasCredentials()).isFalse();
        assertThat(new GatewayRequestSigner("key", " ").hasCredentials()).isFalse();
        assertThat(new GatewayRequestSigner(null, null).hasCredentials()).isFalse();
    }

    private static String hmacHex(String secret, String payload) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }
}
