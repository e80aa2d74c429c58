package org.nowstart.tradeguard.config;

import static org.assertj.core.api.Assertions.assertThat;

import feign.Request;
import feign.Retryer;
import feign.codec.ErrorDecoder;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.nowstart.tradeguard.data.property.ExchangeProperties;
import org.nowstart.tradeguard.service.auth.GatewayRequestSigner;
import org.nowstart.tradeguard.service.exchange.GatewayErrorDecoder;
import org.nowstart.tradeguard.service.exchange.LinearBackoffRetryer;
import org.nowstart.tradeguard.support.TestProperties;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.cloud.autoconfigure.RefreshAutoConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

class ExchangeFeignConfigContextTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(ExchangeFeignConfig.class, ExchangeTestConfig.class)
            .withConfiguration(AutoConfigurations.of(RefreshAutoConfiguration.class));

    @Test
    void contextLoadsWithExchangeFeignConfig() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(GatewayRequestSigner.class);
            assertThat(context.getBean(Retryer.class)).isInstanceOf(LinearBackoffRetryer.class);
            assertThat(context.getBean(ErrorDecoder.class)).isInstanceOf(GatewayErrorDecoder.class);
        });
    }

    @Test
    void requestOptions_followExchangeTimeouts() {
        contextRunner.run(context -> {
            Request.Options options = context.getBean(Request.Options.class);

            assertThat(options.connectTimeoutMillis()).isEqualTo(5_000);
            assertThat(options.readTimeoutMillis()).isEqualTo(10_000);
        });
    }

    @Configuration(proxyBeanMethods = false)
    static class ExchangeTestConfig {

        @Bean
        ExchangeProperties exchangeProperties() {
            return TestProperties.exchange();
        }

        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
        }
    }
}
