package org.nowstart.tradeguard.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.time.Clock;
import org.nowstart.tradeguard.data.dto.CircuitBreakerStatusDto;
import org.nowstart.tradeguard.data.dto.KillSwitchStatusDto;
import org.nowstart.tradeguard.data.dto.KillSwitchTriggerRequest;
import org.nowstart.tradeguard.data.dto.OrderDto;
import org.nowstart.tradeguard.data.dto.Signal;
import org.nowstart.tradeguard.data.dto.SignalExecuteRequest;
import org.nowstart.tradeguard.data.dto.SignalExecuteResponse;
import org.nowstart.tradeguard.data.exception.TradingApiException;
import org.nowstart.tradeguard.service.TradingCycleService;
import org.nowstart.tradeguard.service.execution.OrderManager;
import org.nowstart.tradeguard.service.killswitch.KillSwitchService;
import org.nowstart.tradeguard.service.risk.CircuitBreaker;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/trading")
@Tag(name = "Trading", description = "Kill switch control, order lookup/cancel, manual signals and exchange health")
public class TradingController {

    private final KillSwitchService killSwitchService;
    private final OrderManager orderManager;
    private final TradingCycleService tradingCycleService;
    private final CircuitBreaker circuitBreaker;
    private final Clock clock;

    public TradingController(
            KillSwitchService killSwitchService,
            OrderManager orderManager,
            TradingCycleService tradingCycleService,
            CircuitBreaker circuitBreaker,
            Clock clock
    ) {
        this.killSwitchService = killSwitchService;
        this.orderManager = orderManager;
        this.tradingCycleService = tradingCycleService;
        this.circuitBreaker = circuitBreaker;
        this.clock = clock;
    }

    @GetMapping("/kill-switch")
    @Operation(summary = "Kill switch status", description = "Returns whether trading is halted and why.")
    public KillSwitchStatusDto getKillSwitch() {
        return KillSwitchStatusDto.from(killSwitchService.status());
    }

    @PostMapping("/kill-switch/trigger")
    @Operation(summary = "Trigger kill switch", description = "Halts all new orders until reset. A second trigger keeps the first reason.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Kill switch triggered"),
            @ApiResponse(responseCode = "400", description = "Reason missing")
    })
    public KillSwitchStatusDto triggerKillSwitch(@RequestBody @Valid KillSwitchTriggerRequest request) {
        return KillSwitchStatusDto.from(killSwitchService.trigger(request.reason()));
    }

    @PostMapping("/kill-switch/reset")
    @Operation(summary = "Reset kill switch", description = "Re-arms the kill switch and clears loss and violation counters.")
    public KillSwitchStatusDto resetKillSwitch() {
        return KillSwitchStatusDto.from(killSwitchService.reset());
    }

    @GetMapping("/orders/{clientOrderId}")
    @Operation(summary = "Get order", description = "Looks an order up by client order id.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Found"),
            @ApiResponse(responseCode = "404", description = "Unknown client order id")
    })
    public OrderDto getOrder(@PathVariable String clientOrderId) {
        return orderManager.findByClientOrderId(clientOrderId)
                .map(OrderDto::from)
                .orElseThrow(() -> TradingApiException.orderNotFound(clientOrderId));
    }

    @PostMapping("/orders/{clientOrderId}/cancel")
    @Operation(summary = "Cancel order", description = "Cancels an open order through the active broker.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Canceled"),
            @ApiResponse(responseCode = "404", description = "Unknown client order id"),
            @ApiResponse(responseCode = "409", description = "Order can no longer be canceled")
    })
    public OrderDto cancelOrder(@PathVariable String clientOrderId) {
        return OrderDto.from(orderManager.cancel(clientOrderId));
    }

    @PostMapping("/signals")
    @Operation(summary = "Submit signal", description = "Runs a signal through risk evaluation and, when allowed, submits it idempotently.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Order submitted or matched by idempotency key"),
            @ApiResponse(responseCode = "200", description = "Signal blocked by a risk guard"),
            @ApiResponse(responseCode = "400", description = "Request validation failed"),
            @ApiResponse(responseCode = "503", description = "Exchange circuit open")
    })
    public ResponseEntity<SignalExecuteResponse> submitSignal(@RequestBody @Valid SignalExecuteRequest request) {
        Signal signal = new Signal(request.action(), request.confidence(), request.reason() == null ? "manual" : request.reason());
        TradingCycleService.SignalResult result = tradingCycleService.executeSignal(request.symbol(), signal, request.idempotencyKey());

        SignalExecuteResponse body = new SignalExecuteResponse(result.decision(), result.order().map(OrderDto::from).orElse(null));
        HttpStatus status = result.order().isPresent() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(body);
    }

    @GetMapping("/circuit-breaker")
    @Operation(summary = "Exchange circuit breaker", description = "Consecutive exchange failures and whether calls are currently refused.")
    public CircuitBreakerStatusDto getCircuitBreaker() {
        return new CircuitBreakerStatusDto(
                circuitBreaker.getFailureCount(),
                circuitBreaker.getLastFailureAt(),
                circuitBreaker.isOpen(clock.instant())
        );
    }
}
