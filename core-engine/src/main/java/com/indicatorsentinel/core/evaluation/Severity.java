package com.indicatorsentinel.core.evaluation;

import java.util.Locale;

/**
 * Categorical urgency of an alert, derived from the magnitude of the
 * deviation.
 *
 * @since 1.0.0
 */
public enum Severity {

    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    static final double CRITICAL_FROM = 50;
    static final double HIGH_FROM = 25;
    static final double MEDIUM_FROM = 10;

    /**
     * Bucket a deviation by its absolute value: {@code >= 50} critical,
     * {@code >= 25} high, {@code >= 10} medium, otherwise low.
     *
     * @param deviationPercent signed deviation in percent
     * @return the severity bucket
     */
    public static Severity fromDeviation(double deviationPercent) {
        double magnitude = Math.abs(deviationPercent);
        if (magnitude >= CRITICAL_FROM) {
            return CRITICAL;
        }
        if (magnitude >= HIGH_FROM) {
            return HIGH;
        }
        if (magnitude >= MEDIUM_FROM) {
            return MEDIUM;
        }
        return LOW;
    }

    /**
     * @param code severity name (case-insensitive)
     * @return the matching severity
     * @throws IllegalArgumentException if the code is blank or unknown
     */
    public static Severity fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Severity must not be blank");
        }
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
