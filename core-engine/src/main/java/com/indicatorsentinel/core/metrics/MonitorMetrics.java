package com.indicatorsentinel.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Micrometer meters for the scheduling and evaluation engine.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code indicator.executions} (counter, tag {@code outcome}) – completed
 * runs</li>
 * <li>{@code indicator.execution.duration} (timer) – run latency</li>
 * <li>{@code indicator.alerts.triggered} (counter) – new breach episodes</li>
 * <li>{@code indicator.alerts.resolved} (counter) – resolved alerts</li>
 * <li>{@code indicator.dispatch.skipped} (counter) – due indicators skipped
 * because a run was still in flight</li>
 * <li>{@code indicator.leases.active} (gauge) – runs currently in flight</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class MonitorMetrics {

    private final MeterRegistry registry;
    private final Counter successfulExecutions;
    private final Counter failedExecutions;
    private final Timer executionDuration;
    private final Counter alertsTriggered;
    private final Counter alertsResolved;
    private final Counter dispatchSkipped;

    public MonitorMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "MeterRegistry must not be null");

        this.successfulExecutions = Counter.builder("indicator.executions")
                .description("Completed indicator runs")
                .tag("outcome", "success")
                .register(registry);
        this.failedExecutions = Counter.builder("indicator.executions")
                .description("Completed indicator runs")
                .tag("outcome", "failure")
                .register(registry);

        this.executionDuration = Timer.builder("indicator.execution.duration")
                .description("Time spent collecting and evaluating one indicator")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.alertsTriggered = Counter.builder("indicator.alerts.triggered")
                .description("New breach episodes")
                .register(registry);
        this.alertsResolved = Counter.builder("indicator.alerts.resolved")
                .description("Alerts that returned to normal")
                .register(registry);
        this.dispatchSkipped = Counter.builder("indicator.dispatch.skipped")
                .description("Due indicators skipped because a previous run was still in flight")
                .register(registry);
    }

    /**
     * Register the in-flight gauge. Micrometer polls the supplier on scrape.
     *
     * @param activeLeases supplier of the current number of held leases
     */
    public void bindActiveLeases(Supplier<Number> activeLeases) {
        Gauge.builder("indicator.leases.active", activeLeases, s -> s.get().doubleValue())
                .description("Indicator runs currently in flight")
                .strongReference(true)
                .register(registry);
    }

    public void recordExecution(boolean success, Duration duration) {
        (success ? successfulExecutions : failedExecutions).increment();
        executionDuration.record(duration);
    }

    public void incrementAlertsTriggered() {
        alertsTriggered.increment();
    }

    public void incrementAlertsResolved() {
        alertsResolved.increment();
    }

    public void incrementDispatchSkipped() {
        dispatchSkipped.increment();
    }
}
