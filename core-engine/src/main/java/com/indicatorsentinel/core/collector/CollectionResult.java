package com.indicatorsentinel.core.collector;

import java.util.Objects;

/**
 * What a {@link MetricCollector} returned for one source: the current value
 * and its baseline, or an error.
 *
 * @since 1.0.0
 */
public final class CollectionResult {

    private final double currentValue;
    private final Double baselineValue;
    private final boolean ok;
    private final String error;

    private CollectionResult(double currentValue, Double baselineValue, boolean ok, String error) {
        this.currentValue = currentValue;
        this.baselineValue = baselineValue;
        this.ok = ok;
        this.error = error;
    }

    /**
     * @param currentValue  current reading
     * @param baselineValue historical baseline, may be {@code null}
     * @return a successful result
     */
    public static CollectionResult success(double currentValue, Double baselineValue) {
        return new CollectionResult(currentValue, baselineValue, true, null);
    }

    /**
     * @param error description of the failure; must not be {@code null}
     * @return a failed result
     */
    public static CollectionResult failure(String error) {
        Objects.requireNonNull(error, "error must not be null");
        return new CollectionResult(Double.NaN, null, false, error);
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public Double getBaselineValue() {
        return baselineValue;
    }

    public boolean isOk() {
        return ok;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return ok
                ? "CollectionResult{current=" + currentValue + ", baseline=" + baselineValue + '}'
                : "CollectionResult{error='" + error + "'}";
    }
}
