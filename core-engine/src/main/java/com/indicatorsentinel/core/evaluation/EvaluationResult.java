package com.indicatorsentinel.core.evaluation;

import java.util.Objects;

/**
 * Output of evaluating one reading: the deviation (when the type computes
 * one), whether to alert, and the severity.
 *
 * @since 1.0.0
 */
public final class EvaluationResult {

    private final Double deviationPercent;
    private final boolean shouldAlert;
    private final Severity severity;

    public EvaluationResult(Double deviationPercent, boolean shouldAlert, Severity severity) {
        this.deviationPercent = deviationPercent;
        this.shouldAlert = shouldAlert;
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
    }

    /**
     * Result used when nothing could be computed.
     *
     * @return a non-alerting result without deviation
     */
    public static EvaluationResult indeterminate() {
        return new EvaluationResult(null, false, Severity.LOW);
    }

    /**
     * @return signed deviation in percent, or {@code null} if not applicable or
     *         not computable
     */
    public Double getDeviationPercent() {
        return deviationPercent;
    }

    public boolean shouldAlert() {
        return shouldAlert;
    }

    public Severity getSeverity() {
        return severity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EvaluationResult that))
            return false;
        return shouldAlert == that.shouldAlert
                && Objects.equals(deviationPercent, that.deviationPercent)
                && severity == that.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviationPercent, shouldAlert, severity);
    }

    @Override
    public String toString() {
        return "EvaluationResult{" +
                "deviationPercent=" + deviationPercent +
                ", shouldAlert=" + shouldAlert +
                ", severity=" + severity +
                '}';
    }
}
