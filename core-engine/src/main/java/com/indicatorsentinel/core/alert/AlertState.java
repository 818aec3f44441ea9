package com.indicatorsentinel.core.alert;

import com.indicatorsentinel.core.evaluation.Severity;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Current alert state of one indicator.
 *
 * <p>
 * Immutable; each transition replaces the stored instance. There is exactly
 * one row per indicator, overwritten in place rather than appended.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertState implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int indicatorId;
    private final AlertStatus status;
    private final Instant lastTriggerTime;
    private final Double lastDeviation;
    private final Severity severity;
    private final Instant resolvedTime;

    public AlertState(int indicatorId, AlertStatus status, Instant lastTriggerTime,
            Double lastDeviation, Severity severity, Instant resolvedTime) {
        this.indicatorId = indicatorId;
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.lastTriggerTime = lastTriggerTime;
        this.lastDeviation = lastDeviation;
        this.severity = severity;
        this.resolvedTime = resolvedTime;
    }

    /**
     * @param indicatorId the indicator
     * @return the state of an indicator that has never alerted
     */
    public static AlertState none(int indicatorId) {
        return new AlertState(indicatorId, AlertStatus.NONE, null, null, null, null);
    }

    public boolean isTriggered() {
        return status == AlertStatus.TRIGGERED;
    }

    /**
     * @return the later of the trigger and resolution times, or {@code null}
     *         if neither is set
     */
    public Instant lastChangedAt() {
        if (resolvedTime == null) {
            return lastTriggerTime;
        }
        if (lastTriggerTime == null || resolvedTime.isAfter(lastTriggerTime)) {
            return resolvedTime;
        }
        return lastTriggerTime;
    }

    /**
     * @param from window start, inclusive
     * @param to   window end, inclusive
     * @return {@code true} if the last trigger time lies within the window
     */
    public boolean triggeredWithin(Instant from, Instant to) {
        return lastTriggerTime != null && !lastTriggerTime.isBefore(from) && !lastTriggerTime.isAfter(to);
    }

    public int getIndicatorId() {
        return indicatorId;
    }

    public AlertStatus getStatus() {
        return status;
    }

    public Instant getLastTriggerTime() {
        return lastTriggerTime;
    }

    public Double getLastDeviation() {
        return lastDeviation;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Instant getResolvedTime() {
        return resolvedTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertState that))
            return false;
        return indicatorId == that.indicatorId
                && status == that.status
                && Objects.equals(lastTriggerTime, that.lastTriggerTime)
                && Objects.equals(lastDeviation, that.lastDeviation)
                && severity == that.severity
                && Objects.equals(resolvedTime, that.resolvedTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(indicatorId, status, lastTriggerTime, lastDeviation, severity, resolvedTime);
    }

    @Override
    public String toString() {
        return "AlertState{" +
                "indicatorId=" + indicatorId +
                ", status=" + status +
                ", lastTriggerTime=" + lastTriggerTime +
                ", lastDeviation=" + lastDeviation +
                ", severity=" + severity +
                ", resolvedTime=" + resolvedTime +
                '}';
    }
}
