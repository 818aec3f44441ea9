package com.indicatorsentinel.core.notification;

import com.indicatorsentinel.core.evaluation.Severity;

import java.time.Instant;
import java.util.Objects;

/**
 * Emitted once per breach episode when an indicator's alert becomes active.
 *
 * @since 1.0.0
 */
public final class AlertTriggeredNotification {

    private final int indicatorId;
    private final String name;
    private final String owner;
    private final Severity severity;
    private final double currentValue;
    private final Double baselineValue;
    private final Double deviationPercent;
    private final Instant triggerTime;

    public AlertTriggeredNotification(int indicatorId, String name, String owner, Severity severity,
            double currentValue, Double baselineValue, Double deviationPercent, Instant triggerTime) {
        this.indicatorId = indicatorId;
        this.name = name;
        this.owner = owner;
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.currentValue = currentValue;
        this.baselineValue = baselineValue;
        this.deviationPercent = deviationPercent;
        this.triggerTime = Objects.requireNonNull(triggerTime, "triggerTime must not be null");
    }

    public int getIndicatorId() {
        return indicatorId;
    }

    public String getName() {
        return name;
    }

    public String getOwner() {
        return owner;
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public Double getBaselineValue() {
        return baselineValue;
    }

    public Double getDeviationPercent() {
        return deviationPercent;
    }

    public Instant getTriggerTime() {
        return triggerTime;
    }

    @Override
    public String toString() {
        return "AlertTriggeredNotification{" +
                "indicatorId=" + indicatorId +
                ", name='" + name + '\'' +
                ", severity=" + severity +
                ", currentValue=" + currentValue +
                ", baselineValue=" + baselineValue +
                ", deviationPercent=" + deviationPercent +
                ", triggerTime=" + triggerTime +
                '}';
    }
}
