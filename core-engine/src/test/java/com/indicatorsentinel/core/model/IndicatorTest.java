package com.indicatorsentinel.core.model;

import com.indicatorsentinel.core.support.TestIndicators;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Indicator}.
 */
class IndicatorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Test
    @DisplayName("Should be due on first tick when it never ran")
    void neverRunIsDue() {
        Indicator indicator = TestIndicators.threshold(1, 5, ComparisonOperator.GT).build();

        assertThat(indicator.getLastRun()).isNull();
        assertThat(indicator.isDue(NOW)).isTrue();
        assertThat(indicator.nextRunAt()).isNull();
    }

    @Test
    @DisplayName("Should be due exactly when the frequency has elapsed")
    void dueAtBoundary() {
        Indicator indicator = TestIndicators.threshold(1, 5, ComparisonOperator.GT)
                .frequencyMinutes(5)
                .lastRun(NOW.minus(Duration.ofMinutes(5)))
                .build();

        assertThat(indicator.isDue(NOW)).isTrue();
        assertThat(indicator.isDue(NOW.minusSeconds(1))).isFalse();
        assertThat(indicator.nextRunAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should never be due while inactive")
    void inactiveNeverDue() {
        Indicator indicator = TestIndicators.threshold(1, 5, ComparisonOperator.GT).active(false).build();

        assertThat(indicator.isDue(NOW)).isFalse();
    }

    @Test
    @DisplayName("Should return a copy with the new last run")
    void withLastRunCopies() {
        Indicator original = TestIndicators.successRate(1, 10, 0).build();

        Indicator updated = original.withLastRun(NOW);

        assertThat(updated.getLastRun()).isEqualTo(NOW);
        assertThat(original.getLastRun()).isNull();
        assertThat(updated.getConfig()).isEqualTo(original.getConfig());
    }

    @Test
    @DisplayName("Should use the configured window for deviation types and the frequency for thresholds")
    void windowMinutes() {
        assertThat(TestIndicators.trend(1, 10, 120).build().windowMinutes()).isEqualTo(120);
        assertThat(TestIndicators.threshold(2, 1, ComparisonOperator.LT).frequencyMinutes(15).build()
                .windowMinutes()).isEqualTo(15);
    }

    @Test
    @DisplayName("Should require type and configuration")
    void requiresTypeAndConfig() {
        assertThatThrownBy(() -> Indicator.builder().id(1).name("x").build())
                .isInstanceOf(NullPointerException.class);
    }
}
