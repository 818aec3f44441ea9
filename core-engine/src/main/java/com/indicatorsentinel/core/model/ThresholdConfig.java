package com.indicatorsentinel.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Configuration of a {@code threshold} indicator: alert when
 * {@code current <operator> thresholdValue} holds.
 *
 * @since 1.0.0
 */
public final class ThresholdConfig extends IndicatorConfig {

    private static final long serialVersionUID = 1L;

    private final double thresholdValue;
    private final ComparisonOperator operator;

    /**
     * @param thresholdValue value the current reading is compared against
     * @param operator       comparison to apply; must not be {@code null}
     */
    public ThresholdConfig(double thresholdValue, ComparisonOperator operator) {
        this.thresholdValue = thresholdValue;
        this.operator = Objects.requireNonNull(operator, "Comparison operator must not be null");
    }

    public double getThresholdValue() {
        return thresholdValue;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    @Override
    public boolean supports(IndicatorType type) {
        return type == IndicatorType.THRESHOLD;
    }

    /**
     * Threshold readings cover the interval since the previous run.
     */
    @Override
    public int windowMinutes(int frequencyMinutes) {
        return frequencyMinutes;
    }

    @Override
    public void validate(String indicatorName, List<String> errors, List<String> warnings) {
        if (!Double.isFinite(thresholdValue)) {
            errors.add("Threshold indicator '" + indicatorName + "' requires a finite 'thresholdValue'");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ThresholdConfig that))
            return false;
        return Double.compare(thresholdValue, that.thresholdValue) == 0 && operator == that.operator;
    }

    @Override
    public int hashCode() {
        return Objects.hash(thresholdValue, operator);
    }

    @Override
    public String toString() {
        return "ThresholdConfig{" + operator.code() + " " + thresholdValue + '}';
    }
}
