package org.nowstart.tradeguard.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.nowstart.tradeguard.service.metrics.PrometheusTradingMetrics;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Tag(name = "Metrics")
public class MetricsController {

    static final String PROMETHEUS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private final PrometheusTradingMetrics prometheusTradingMetrics;

    @GetMapping(value = "/metrics", produces = PROMETHEUS_CONTENT_TYPE)
    @Operation(summary = "Prometheus metrics", description = "Counters, gauges and summaries in Prometheus text format.")
    public String metrics() {
        return prometheusTradingMetrics.render();
    }
}
