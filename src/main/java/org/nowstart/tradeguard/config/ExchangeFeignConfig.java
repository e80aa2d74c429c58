package org.nowstart.tradeguard.config;

import feign.Request;
import feign.RequestInterceptor;
import feign.Retryer;
import feign.codec.ErrorDecoder;
import java.time.Clock;
import java.util.concurrent.TimeUnit;
import org.nowstart.tradeguard.data.property.ExchangeProperties;
import org.nowstart.tradeguard.service.auth.GatewayAuthRequestInterceptor;
import org.nowstart.tradeguard.service.auth.GatewayRequestSigner;
import org.nowstart.tradeguard.service.exchange.GatewayErrorDecoder;
import org.nowstart.tradeguard.service.exchange.LinearBackoffRetryer;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExchangeFeignConfig {

    @Bean
    @RefreshScope
    public GatewayRequestSigner gatewayRequestSigner(ExchangeProperties exchangeProperties) {
        return new GatewayRequestSigner(exchangeProperties.apiKey(), exchangeProperties.apiSecret());
    }

    @Bean
    @RefreshScope
    public RequestInterceptor gatewayAuthRequestInterceptor(GatewayRequestSigner gatewayRequestSigner, Clock clock) {
        return new GatewayAuthRequestInterceptor(gatewayRequestSigner, clock);
    }

    @Bean
    public Request.Options exchangeRequestOptions(ExchangeProperties exchangeProperties) {
        return new Request.Options(
                exchangeProperties.connectTimeout().toMillis(), TimeUnit.MILLISECONDS,
                exchangeProperties.readTimeout().toMillis(), TimeUnit.MILLISECONDS,
                true
        );
    }

    @Bean
    public Retryer exchangeRetryer(ExchangeProperties exchangeProperties) {
        return new LinearBackoffRetryer(exchangeProperties.retryAttempts(), exchangeProperties.retryBaseDelay());
    }

    @Bean
    public ErrorDecoder exchangeErrorDecoder() {
        return new GatewayErrorDecoder();
    }
}
