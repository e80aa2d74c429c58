package org.nowstart.tradeguard.service.metrics;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * In-process metrics registry rendered in the Prometheus text exposition format.
 * Counters, gauges and summaries share one namespace prefix.
 */
@Component
public class PrometheusTradingMetrics implements TradingMetrics {

    static final String PREFIX = "tradeguard_";
    static final int MAX_OBSERVATIONS = 1000;

    private static final Pattern INVALID_NAME_CHARS = Pattern.compile("[^a-zA-Z0-9_]");

    private final Map<String, Double> counters = new ConcurrentHashMap<>();
    private final Map<String, Double> gauges = new ConcurrentHashMap<>();
    private final Map<String, Deque<Double>> summaries = new ConcurrentHashMap<>();

    @Override
    public void increment(String name, double value) {
        counters.merge(sanitize(name), value, Double::sum);
    }

    @Override
    public void gauge(String name, double value) {
        gauges.put(sanitize(name), value);
    }

    @Override
    public void observe(String name, double value) {
        Deque<Double> values = summaries.computeIfAbsent(sanitize(name), key -> new ArrayDeque<>());
        synchronized (values) {
            values.addLast(value);
            if (values.size() > MAX_OBSERVATIONS) {
                values.removeFirst();
            }
        }
    }

    public double counter(String name) {
        return counters.getOrDefault(sanitize(name), 0.0);
    }

    public Double gaugeValue(String name) {
        return gauges.get(sanitize(name));
    }

    public String render() {
        StringBuilder out = new StringBuilder();
        new TreeMap<>(counters).forEach((name, value) -> {
            out.append("# TYPE ").append(PREFIX).append(name).append(" counter\n");
            out.append(PREFIX).append(name).append(' ').append(format(value)).append('\n');
        });
        new TreeMap<>(gauges).forEach((name, value) -> {
            out.append("# TYPE ").append(PREFIX).append(name).append(" gauge\n");
            out.append(PREFIX).append(name).append(' ').append(format(value)).append('\n');
        });
        new TreeMap<>(summaries).forEach((name, values) -> {
            double sum;
            int count;
            synchronized (values) {
                if (values.isEmpty()) {
                    return;
                }
                sum = values.stream().mapToDouble(Double::doubleValue).sum();
                count = values.size();
            }
            out.append("# TYPE ").append(PREFIX).append(name).append(" summary\n");
            out.append(PREFIX).append(name).append("_sum ").append(format(sum)).append('\n');
            out.append(PREFIX).append(name).append("_count ").append(count).append('\n');
        });
        return out.toString();
    }

    private String sanitize(String name) {
        return INVALID_NAME_CHARS.matcher(name).replaceAll("_");
    }

    private String format(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
