package org.nowstart.tradeguard.config;

import org.nowstart.tradeguard.repository.ExchangeGatewayFeignClient;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;

// Kept off the application class so JPA slice tests do not try to build Feign clients.
@Configuration
@EnableFeignClients(clients = ExchangeGatewayFeignClient.class)
public class ExchangeClientConfig {
}
