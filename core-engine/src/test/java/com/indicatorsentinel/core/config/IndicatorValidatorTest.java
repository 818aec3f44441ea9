package com.indicatorsentinel.core.config;

import com.indicatorsentinel.core.model.ComparisonOperator;
import com.indicatorsentinel.core.model.Indicator;
import com.indicatorsentinel.core.model.IndicatorType;
import com.indicatorsentinel.core.model.ThresholdConfig;
import com.indicatorsentinel.core.model.VolumeDeviationConfig;
import com.indicatorsentinel.core.support.TestIndicators;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link IndicatorValidator}.
 */
class IndicatorValidatorTest {

    @Test
    @DisplayName("Should accept a complete indicator")
    void shouldAcceptValidIndicator() {
        ValidationResult result = IndicatorValidator.validate(TestIndicators.successRate(1, 10, 5).build());

        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    @DisplayName("Should reject non-positive frequency")
    void shouldRejectZeroFrequency() {
        Indicator indicator = TestIndicators.threshold(1, 5, ComparisonOperator.GT).frequencyMinutes(0).build();

        assertThatThrownBy(() -> IndicatorValidator.requireValid(indicator))
                .isInstanceOf(IndicatorValidationException.class)
                .hasMessageContaining("'frequency' > 0");
    }

    @Test
    @DisplayName("Should reject a configuration variant that does not match the type")
    void shouldRejectMismatchedConfig() {
        Indicator indicator = TestIndicators.threshold(1, 5, ComparisonOperator.GT)
                .type(IndicatorType.SUCCESS_RATE)
                .build();

        ValidationResult result = IndicatorValidator.validate(indicator);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).singleElement().asString().contains("ThresholdConfig");
    }

    @Test
    @DisplayName("Should reject deviation percent outside [0, 100] and negative minimum threshold")
    void shouldRejectOutOfRangeDeviationFields() {
        Indicator indicator = TestIndicators.successRate(1, 120, 5)
                .config(new VolumeDeviationConfig(120, 30, -1))
                .build();

        ValidationResult result = IndicatorValidator.validate(indicator);

        assertThat(result.getErrors()).hasSize(2);
    }

    @Test
    @DisplayName("Should warn about very long and very short windows without rejecting")
    void shouldWarnOnWindows() {
        Indicator longWindow = TestIndicators.successRate(1, 10, 0)
                .config(new VolumeDeviationConfig(10, 20_000, 0))
                .build();
        Indicator shortTrend = TestIndicators.trend(2, 10, 30).build();

        ValidationResult longResult = IndicatorValidator.validate(longWindow);
        ValidationResult trendResult = IndicatorValidator.validate(shortTrend);

        assertThat(longResult.isValid()).isTrue();
        assertThat(longResult.getWarnings()).hasSize(1);
        assertThat(trendResult.isValid()).isTrue();
        assertThat(trendResult.getWarnings()).hasSize(1);
    }

    @Test
    @DisplayName("Should reject a non-finite threshold value")
    void shouldRejectNonFiniteThreshold() {
        Indicator indicator = TestIndicators.threshold(1, 0, ComparisonOperator.GT)
                .config(new ThresholdConfig(Double.NaN, ComparisonOperator.GT))
                .build();

        assertThat(IndicatorValidator.validate(indicator).isValid()).isFalse();
    }
}
