package com.indicatorsentinel.core.evaluation;

import java.util.OptionalDouble;

/**
 * Relative deviation of a current value from its baseline.
 *
 * @since 1.0.0
 */
public final class DeviationCalculator {

    private DeviationCalculator() {
        // utility class, not instantiable
    }

    /**
     * {@code (current - baseline) / baseline * 100}.
     *
     * @param currentValue  current reading
     * @param baselineValue historical baseline, may be {@code null}
     * @return the signed deviation, or empty when the baseline is absent, zero
     *         or either input is not finite
     */
    public static OptionalDouble deviationPercent(double currentValue, Double baselineValue) {
        if (baselineValue == null || baselineValue == 0.0
                || !Double.isFinite(baselineValue) || !Double.isFinite(currentValue)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((currentValue - baselineValue) / baselineValue * 100.0);
    }
}
