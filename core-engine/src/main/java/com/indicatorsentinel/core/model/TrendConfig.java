package com.indicatorsentinel.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Configuration of a {@code trend_analysis} indicator.
 *
 * @since 1.0.0
 */
public final class TrendConfig extends DeviationConfig {

    private static final long serialVersionUID = 1L;

    /** Shorter trend windows are accepted but flagged. */
    static final int RECOMMENDED_MIN_WINDOW_MINUTES = 60;

    public TrendConfig(double deviationPercent, int lastMinutes) {
        super(deviationPercent, lastMinutes);
    }

    @Override
    public boolean supports(IndicatorType type) {
        return type == IndicatorType.TREND_ANALYSIS;
    }

    @Override
    public void validate(String indicatorName, List<String> errors, List<String> warnings) {
        super.validate(indicatorName, errors, warnings);
        if (getLastMinutes() >= 1 && getLastMinutes() < RECOMMENDED_MIN_WINDOW_MINUTES) {
            warnings.add("Trend indicator '" + indicatorName + "' uses a " + getLastMinutes()
                    + " minute window; at least " + RECOMMENDED_MIN_WINDOW_MINUTES + " is recommended");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TrendConfig that))
            return false;
        return Double.compare(getDeviationPercent(), that.getDeviationPercent()) == 0
                && getLastMinutes() == that.getLastMinutes();
    }

    @Override
    public int hashCode() {
        return Objects.hash(getDeviationPercent(), getLastMinutes());
    }

    @Override
    public String toString() {
        return "TrendConfig{deviationPercent=" + getDeviationPercent() + ", lastMinutes=" + getLastMinutes() + '}';
    }
}
