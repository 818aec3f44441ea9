package com.indicatorsentinel.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Configuration of {@code success_rate} and {@code transaction_volume}
 * indicators.
 *
 * <p>
 * {@code minimumThreshold} gates alerting: when the current value is below it
 * the sample is considered too small to be meaningful.
 * </p>
 *
 * @since 1.0.0
 */
public final class VolumeDeviationConfig extends DeviationConfig {

    private static final long serialVersionUID = 1L;

    private final double minimumThreshold;

    public VolumeDeviationConfig(double deviationPercent, int lastMinutes, double minimumThreshold) {
        super(deviationPercent, lastMinutes);
        this.minimumThreshold = minimumThreshold;
    }

    public double getMinimumThreshold() {
        return minimumThreshold;
    }

    @Override
    public boolean supports(IndicatorType type) {
        return type == IndicatorType.SUCCESS_RATE || type == IndicatorType.TRANSACTION_VOLUME;
    }

    @Override
    public void validate(String indicatorName, List<String> errors, List<String> warnings) {
        super.validate(indicatorName, errors, warnings);
        if (!(minimumThreshold >= 0) || Double.isInfinite(minimumThreshold)) {
            errors.add("Indicator '" + indicatorName + "' requires 'minimumThreshold' >= 0, got: "
                    + minimumThreshold);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof VolumeDeviationConfig that))
            return false;
        return Double.compare(getDeviationPercent(), that.getDeviationPercent()) == 0
                && getLastMinutes() == that.getLastMinutes()
                && Double.compare(minimumThreshold, that.minimumThreshold) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(getDeviationPercent(), getLastMinutes(), minimumThreshold);
    }

    @Override
    public String toString() {
        return "VolumeDeviationConfig{" +
                "deviationPercent=" + getDeviationPercent() +
                ", lastMinutes=" + getLastMinutes() +
                ", minimumThreshold=" + minimumThreshold +
                '}';
    }
}
