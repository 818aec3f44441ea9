package com.indicatorsentinel.core.evaluation;

import com.indicatorsentinel.core.model.ComparisonOperator;
import com.indicatorsentinel.core.model.IndicatorType;
import com.indicatorsentinel.core.model.ThresholdConfig;
import com.indicatorsentinel.core.model.TrendConfig;
import com.indicatorsentinel.core.model.VolumeDeviationConfig;
import com.indicatorsentinel.core.support.TestIndicators;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Evaluator} and the per-type evaluators behind it.
 */
class EvaluatorTest {

    private final Evaluator evaluator = new Evaluator();

    @Nested
    @DisplayName("threshold")
    class Threshold {

        @Test
        @DisplayName("Should alert on gte equality but not on gt equality")
        void equalityBoundary() {
            EvaluationResult gte = evaluator.evaluate(IndicatorType.THRESHOLD,
                    new ThresholdConfig(10, ComparisonOperator.GTE), 10, null);
            EvaluationResult gt = evaluator.evaluate(IndicatorType.THRESHOLD,
                    new ThresholdConfig(10, ComparisonOperator.GT), 10, null);

            assertThat(gte.shouldAlert()).isTrue();
            assertThat(gt.shouldAlert()).isFalse();
        }

        @Test
        @DisplayName("Should report no deviation and the configured default severity")
        void noDeviationDefaultSeverity() {
            EvaluationResult result = evaluator.evaluate(IndicatorType.THRESHOLD,
                    new ThresholdConfig(10, ComparisonOperator.LT), 5, 100.0);

            assertThat(result.shouldAlert()).isTrue();
            assertThat(result.getDeviationPercent()).isNull();
            assertThat(result.getSeverity()).isEqualTo(Severity.MEDIUM);
        }

        @Test
        @DisplayName("Should use a custom breach severity")
        void customSeverity() {
            Evaluator critical = new Evaluator(Severity.CRITICAL);

            EvaluationResult result = critical.evaluate(IndicatorType.THRESHOLD,
                    new ThresholdConfig(1, ComparisonOperator.GT), 2, null);

            assertThat(result.getSeverity()).isEqualTo(Severity.CRITICAL);
        }

        @Test
        @DisplayName("Should not alert on a non-finite reading")
        void nonFinite() {
            EvaluationResult result = evaluator.evaluate(IndicatorType.THRESHOLD,
                    new ThresholdConfig(1, ComparisonOperator.LT), Double.NaN, null);

            assertThat(result.shouldAlert()).isFalse();
        }
    }

    @Nested
    @DisplayName("success_rate / transaction_volume")
    class Volume {

        @Test
        @DisplayName("Should compute signed deviation against the baseline")
        void signedDeviation() {
            VolumeDeviationConfig config = new VolumeDeviationConfig(15, 30, 0);

            EvaluationResult up = evaluator.evaluate(IndicatorType.SUCCESS_RATE, config, 120, 100.0);
            EvaluationResult down = evaluator.evaluate(IndicatorType.TRANSACTION_VOLUME, config, 80, 100.0);

            assertThat(up.getDeviationPercent()).isCloseTo(20.0, within(1e-9));
            assertThat(down.getDeviationPercent()).isCloseTo(-20.0, within(1e-9));
            assertThat(up.shouldAlert()).isTrue();
            assertThat(down.shouldAlert()).isTrue();
            assertThat(down.getSeverity()).isEqualTo(Severity.MEDIUM);
        }

        @Test
        @DisplayName("Should alert when deviation equals the configured percent")
        void alertAtExactPercent() {
            EvaluationResult result = evaluator.evaluate(IndicatorType.SUCCESS_RATE,
                    new VolumeDeviationConfig(20, 30, 0), 120, 100.0);

            assertThat(result.shouldAlert()).isTrue();
        }

        @Test
        @DisplayName("Should not alert below the configured percent")
        void noAlertBelowPercent() {
            EvaluationResult result = evaluator.evaluate(IndicatorType.SUCCESS_RATE,
                    new VolumeDeviationConfig(25, 30, 0), 120, 100.0);

            assertThat(result.shouldAlert()).isFalse();
            assertThat(result.getDeviationPercent()).isCloseTo(20.0, within(1e-9));
        }

        @Test
        @DisplayName("Should never alert below the minimum threshold")
        void minimumThresholdGate() {
            EvaluationResult result = evaluator.evaluate(IndicatorType.SUCCESS_RATE,
                    new VolumeDeviationConfig(10, 30, 10), 5, 100.0);

            assertThat(result.shouldAlert()).isFalse();
            assertThat(result.getDeviationPercent()).isCloseTo(-95.0, within(1e-9));
        }

        @Test
        @DisplayName("Should not compute a deviation against a zero or absent baseline")
        void zeroOrAbsentBaseline() {
            VolumeDeviationConfig config = new VolumeDeviationConfig(10, 30, 0);

            EvaluationResult zero = evaluator.evaluate(IndicatorType.SUCCESS_RATE, config, 50, 0.0);
            EvaluationResult absent = evaluator.evaluate(IndicatorType.SUCCESS_RATE, config, 50, null);

            assertThat(zero).isEqualTo(EvaluationResult.indeterminate());
            assertThat(absent.shouldAlert()).isFalse();
            assertThat(absent.getDeviationPercent()).isNull();
        }
    }

    @Nested
    @DisplayName("trend_analysis")
    class Trend {

        @Test
        @DisplayName("Should apply the same deviation rule as volume indicators")
        void sameFormula() {
            EvaluationResult result = evaluator.evaluate(IndicatorType.TREND_ANALYSIS,
                    new TrendConfig(30, 1440), 45, 100.0);

            assertThat(result.getDeviationPercent()).isCloseTo(-55.0, within(1e-9));
            assertThat(result.shouldAlert()).isTrue();
            assertThat(result.getSeverity()).isEqualTo(Severity.CRITICAL);
        }

        @Test
        @DisplayName("Should not apply a minimum-volume gate")
        void noGate() {
            EvaluationResult result = evaluator.evaluate(IndicatorType.TREND_ANALYSIS,
                    new TrendConfig(10, 60), 1, 2.0);

            assertThat(result.shouldAlert()).isTrue();
        }
    }

    @Test
    @DisplayName("Should reject a configuration that does not match the type")
    void rejectsMismatch() {
        assertThatThrownBy(() -> evaluator.evaluate(IndicatorType.TREND_ANALYSIS,
                new ThresholdConfig(1, ComparisonOperator.GT), 1, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should take type and configuration from the indicator")
    void fromIndicator() {
        EvaluationResult result = evaluator.evaluate(
                TestIndicators.threshold(1, 100, ComparisonOperator.GT).build(), 150, null);

        assertThat(result.shouldAlert()).isTrue();
    }
}
