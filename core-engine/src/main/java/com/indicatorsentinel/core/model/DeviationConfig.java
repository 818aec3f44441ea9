package com.indicatorsentinel.core.model;

import java.util.List;

/**
 * Shared shape of the baseline-deviation variants.
 *
 * @since 1.0.0
 */
public abstract class DeviationConfig extends IndicatorConfig {

    private static final long serialVersionUID = 1L;

    /** Windows longer than a week are accepted but flagged. */
    static final int MAX_RECOMMENDED_WINDOW_MINUTES = 10_080;

    private final double deviationPercent;
    private final int lastMinutes;

    DeviationConfig(double deviationPercent, int lastMinutes) {
        this.deviationPercent = deviationPercent;
        this.lastMinutes = lastMinutes;
    }

    /**
     * @return absolute deviation, in percent, at or above which an alert fires
     */
    public double getDeviationPercent() {
        return deviationPercent;
    }

    public int getLastMinutes() {
        return lastMinutes;
    }

    @Override
    public int windowMinutes(int frequencyMinutes) {
        return lastMinutes;
    }

    @Override
    public void validate(String indicatorName, List<String> errors, List<String> warnings) {
        if (!(deviationPercent >= 0 && deviationPercent <= 100)) {
            errors.add("Indicator '" + indicatorName + "' requires 'deviationPercent' in [0, 100], got: "
                    + deviationPercent);
        }
        if (lastMinutes < 1) {
            errors.add("Indicator '" + indicatorName + "' requires 'lastMinutes' >= 1, got: " + lastMinutes);
        } else if (lastMinutes > MAX_RECOMMENDED_WINDOW_MINUTES) {
            warnings.add("Indicator '" + indicatorName + "' has 'lastMinutes' > 7 days (" + lastMinutes
                    + "), consider if this is intentional");
        }
    }
}
