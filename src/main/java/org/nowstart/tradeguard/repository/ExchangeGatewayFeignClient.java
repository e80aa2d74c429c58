package org.nowstart.tradeguard.repository;

import java.util.List;
import org.nowstart.tradeguard.config.ExchangeFeignConfig;
import org.nowstart.tradeguard.data.dto.GatewayBalanceResponse;
import org.nowstart.tradeguard.data.dto.GatewayCandleResponse;
import org.nowstart.tradeguard.data.dto.GatewayCreateOrderRequest;
import org.nowstart.tradeguard.data.dto.GatewayOrderResponse;
import org.nowstart.tradeguard.data.dto.GatewayTickerResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

@FeignClient(
        name = "exchangeGateway",
        url = "${tradeguard.exchange.base-url}",
        configuration = ExchangeFeignConfig.class
)
public interface ExchangeGatewayFeignClient {

    @GetMapping("/v1/ticker")
    GatewayTickerResponse getTicker(@RequestParam("symbol") String symbol);

    @GetMapping("/v1/candles")
    List<GatewayCandleResponse> getCandles(
            @RequestParam("symbol") String symbol,
            @RequestParam("interval") String interval,
            @RequestParam("limit") int limit
    );

    @PostMapping(value = "/v1/orders", consumes = "application/json")
    GatewayOrderResponse createOrder(@RequestBody GatewayCreateOrderRequest request);

    @DeleteMapping("/v1/orders/{orderId}")
    GatewayOrderResponse cancelOrder(@PathVariable("orderId") String orderId, @RequestParam("symbol") String symbol);

    @GetMapping("/v1/orders/{orderId}")
    GatewayOrderResponse getOrder(@PathVariable("orderId") String orderId, @RequestParam("symbol") String symbol);

    @GetMapping("/v1/orders/open")
    List<GatewayOrderResponse> getOpenOrders(@RequestParam(value = "symbol", required = false) String symbol);

    @GetMapping("/v1/balances")
    List<GatewayBalanceResponse> getBalances();
}
