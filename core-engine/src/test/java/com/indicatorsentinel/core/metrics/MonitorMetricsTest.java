package com.indicatorsentinel.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MonitorMetrics}.
 */
class MonitorMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MonitorMetrics metrics = new MonitorMetrics(registry);

    @Test
    @DisplayName("Should count executions by outcome and time them")
    void executions() {
        metrics.recordExecution(true, Duration.ofMillis(40));
        metrics.recordExecution(true, Duration.ofMillis(60));
        metrics.recordExecution(false, Duration.ofMillis(5));

        assertThat(registry.get("indicator.executions").tag("outcome", "success").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("indicator.executions").tag("outcome", "failure").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("indicator.execution.duration").timer().count()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should expose alert and skip counters")
    void counters() {
        metrics.incrementAlertsTriggered();
        metrics.incrementAlertsResolved();
        metrics.incrementAlertsResolved();
        metrics.incrementDispatchSkipped();

        assertThat(registry.get("indicator.alerts.triggered").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("indicator.alerts.resolved").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("indicator.dispatch.skipped").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should read the active lease gauge on demand")
    void activeLeasesGauge() {
        AtomicInteger active = new AtomicInteger(3);
        metrics.bindActiveLeases(active::get);

        assertThat(registry.get("indicator.leases.active").gauge().value()).isEqualTo(3.0);
        active.set(1);
        assertThat(registry.get("indicator.leases.active").gauge().value()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject a null registry")
    void nullRegistry() {
        assertThatThrownBy(() -> new MonitorMetrics(null)).isInstanceOf(NullPointerException.class);
    }
}
