package com.indicatorsentinel.core.dashboard;

/**
 * Categorical system health, bucketed from the share of active indicators
 * without a recent alert.
 */
public enum SystemHealth {
    EXCELLENT,
    GOOD,
    FAIR,
    POOR,
    CRITICAL,
    UNKNOWN;

    /**
     * @param healthyPercentage share of healthy indicators, 0-100; {@code null}
     *                          when there are no active indicators
     * @return the matching bucket
     */
    public static SystemHealth fromPercentage(Double healthyPercentage) {
        if (healthyPercentage == null) {
            return UNKNOWN;
        }
        double p = healthyPercentage;
        if (p >= 90) {
            return EXCELLENT;
        }
        if (p >= 75) {
            return GOOD;
        }
        if (p >= 50) {
            return FAIR;
        }
        if (p >= 25) {
            return POOR;
        }
        return CRITICAL;
    }
}
