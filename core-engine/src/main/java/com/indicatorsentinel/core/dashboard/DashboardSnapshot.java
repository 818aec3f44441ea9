package com.indicatorsentinel.core.dashboard;

import com.indicatorsentinel.core.ledger.ExecutionRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Derived statistics over indicators, executions and alert states, computed
 * as of one instant. Never a source of truth.
 *
 * @since 1.0.0
 */
public final class DashboardSnapshot {

    private final Instant generatedAt;
    private final Duration window;
    private final int totalIndicators;
    private final int activeIndicators;
    private final int inactiveIndicators;
    private final int dueIndicators;
    private final int runningIndicators;
    private final int executionsInWindow;
    private final int failedExecutionsInWindow;
    private final int alertsInWindow;
    private final int indicatorsInAlert;
    private final double systemLoad;
    private final Double healthPercentage;
    private final SystemHealth systemHealth;
    private final List<ExecutionRecord> recentExecutions;
    private final NextDueIndicator nextDue;

    private DashboardSnapshot(Builder b) {
        this.generatedAt = Objects.requireNonNull(b.generatedAt, "generatedAt must not be null");
        this.window = Objects.requireNonNull(b.window, "window must not be null");
        this.totalIndicators = b.totalIndicators;
        this.activeIndicators = b.activeIndicators;
        this.inactiveIndicators = b.inactiveIndicators;
        this.dueIndicators = b.dueIndicators;
        this.runningIndicators = b.runningIndicators;
        this.executionsInWindow = b.executionsInWindow;
        this.failedExecutionsInWindow = b.failedExecutionsInWindow;
        this.alertsInWindow = b.alertsInWindow;
        this.indicatorsInAlert = b.indicatorsInAlert;
        this.systemLoad = b.systemLoad;
        this.healthPercentage = b.healthPercentage;
        this.systemHealth = SystemHealth.fromPercentage(b.healthPercentage);
        this.recentExecutions = List.copyOf(b.recentExecutions);
        this.nextDue = b.nextDue;
    }

    static Builder builder() {
        return new Builder();
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public Duration getWindow() {
        return window;
    }

    public int getTotalIndicators() {
        return totalIndicators;
    }

    public int getActiveIndicators() {
        return activeIndicators;
    }

    public int getInactiveIndicators() {
        return inactiveIndicators;
    }

    public int getDueIndicators() {
        return dueIndicators;
    }

    public int getRunningIndicators() {
        return runningIndicators;
    }

    public int getExecutionsInWindow() {
        return executionsInWindow;
    }

    public int getFailedExecutionsInWindow() {
        return failedExecutionsInWindow;
    }

    public int getAlertsInWindow() {
        return alertsInWindow;
    }

    public int getIndicatorsInAlert() {
        return indicatorsInAlert;
    }

    /** Due indicators as a percentage of active ones; 0 with no active indicators. */
    public double getSystemLoad() {
        return systemLoad;
    }

    /** Percentage of active indicators without an alert in the window, or {@code null}. */
    public Double getHealthPercentage() {
        return healthPercentage;
    }

    public SystemHealth getSystemHealth() {
        return systemHealth;
    }

    /** Newest first. */
    public List<ExecutionRecord> getRecentExecutions() {
        return recentExecutions;
    }

    /** May be {@code null} when no indicator has a future run scheduled. */
    public NextDueIndicator getNextDue() {
        return nextDue;
    }

    @Override
    public String toString() {
        return "DashboardSnapshot{" +
                "generatedAt=" + generatedAt +
                ", active=" + activeIndicators +
                ", due=" + dueIndicators +
                ", running=" + runningIndicators +
                ", executions=" + executionsInWindow +
                ", alerts=" + alertsInWindow +
                ", systemLoad=" + systemLoad +
                ", systemHealth=" + systemHealth +
                '}';
    }

    static class Builder {
        private Instant generatedAt;
        private Duration window;
        private int totalIndicators;
        private int activeIndicators;
        private int inactiveIndicators;
        private int dueIndicators;
        private int runningIndicators;
        private int executionsInWindow;
        private int failedExecutionsInWindow;
        private int alertsInWindow;
        private int indicatorsInAlert;
        private double systemLoad;
        private Double healthPercentage;
        private List<ExecutionRecord> recentExecutions = List.of();
        private NextDueIndicator nextDue;

        Builder generatedAt(Instant generatedAt) {
            this.generatedAt = generatedAt;
            return this;
        }

        Builder window(Duration window) {
            this.window = window;
            return this;
        }

        Builder totalIndicators(int totalIndicators) {
            this.totalIndicators = totalIndicators;
            return this;
        }

        Builder activeIndicators(int activeIndicators) {
            this.activeIndicators = activeIndicators;
            return this;
        }

        Builder inactiveIndicators(int inactiveIndicators) {
            this.inactiveIndicators = inactiveIndicators;
            return this;
        }

        Builder dueIndicators(int dueIndicators) {
            this.dueIndicators = dueIndicators;
            return this;
        }

        Builder runningIndicators(int runningIndicators) {
            this.runningIndicators = runningIndicators;
            return this;
        }

        Builder executionsInWindow(int executionsInWindow) {
            this.executionsInWindow = executionsInWindow;
            return this;
        }

        Builder failedExecutionsInWindow(int failedExecutionsInWindow) {
            this.failedExecutionsInWindow = failedExecutionsInWindow;
            return this;
        }

        Builder alertsInWindow(int alertsInWindow) {
            this.alertsInWindow = alertsInWindow;
            return this;
        }

        Builder indicatorsInAlert(int indicatorsInAlert) {
            this.indicatorsInAlert = indicatorsInAlert;
            return this;
        }

        Builder systemLoad(double systemLoad) {
            this.systemLoad = systemLoad;
            return this;
        }

        Builder healthPercentage(Double healthPercentage) {
            this.healthPercentage = healthPercentage;
            return this;
        }

        Builder recentExecutions(List<ExecutionRecord> recentExecutions) {
            this.recentExecutions = recentExecutions;
            return this;
        }

        Builder nextDue(NextDueIndicator nextDue) {
            this.nextDue = nextDue;
            return this;
        }

        DashboardSnapshot build() {
            return new DashboardSnapshot(this);
        }
    }
}
