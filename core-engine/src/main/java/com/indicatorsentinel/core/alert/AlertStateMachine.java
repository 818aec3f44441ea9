package com.indicatorsentinel.core.alert;

import com.indicatorsentinel.core.evaluation.Severity;

import java.time.Instant;
import java.util.Objects;

/**
 * Pure transition function of the per-indicator alert state.
 *
 * <table>
 * <caption>Transitions</caption>
 * <tr><th>shouldAlert</th><th>current</th><th>result</th></tr>
 * <tr><td>true</td><td>NONE / RESOLVED</td><td>TRIGGERED, trigger time = now</td></tr>
 * <tr><td>true</td><td>TRIGGERED</td><td>deviation and severity refreshed, no new alert</td></tr>
 * <tr><td>false</td><td>TRIGGERED</td><td>RESOLVED, resolved time = now</td></tr>
 * <tr><td>false</td><td>NONE / RESOLVED</td><td>unchanged</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class AlertStateMachine {

    private AlertStateMachine() {
        // utility class, not instantiable
    }

    /**
     * @param current     current state; must not be {@code null}
     * @param shouldAlert evaluator decision
     * @param severity    evaluator severity; required when {@code shouldAlert}
     * @param deviation   evaluator deviation, may be {@code null}
     * @param now         transition time; must not be {@code null}
     * @return the outcome, including the state to store
     */
    public static TransitionOutcome apply(AlertState current, boolean shouldAlert,
            Severity severity, Double deviation, Instant now) {
        Objects.requireNonNull(current, "current state must not be null");
        Objects.requireNonNull(now, "now must not be null");

        if (shouldAlert) {
            Objects.requireNonNull(severity, "severity must not be null when alerting");
            if (current.isTriggered()) {
                AlertState refreshed = new AlertState(current.getIndicatorId(), AlertStatus.TRIGGERED,
                        current.getLastTriggerTime(), deviation, severity, null);
                return new TransitionOutcome(AlertTransition.UPDATED, current, refreshed);
            }
            AlertState triggered = new AlertState(current.getIndicatorId(), AlertStatus.TRIGGERED,
                    now, deviation, severity, null);
            return new TransitionOutcome(AlertTransition.TRIGGERED, current, triggered);
        }

        if (current.isTriggered()) {
            AlertState resolved = new AlertState(current.getIndicatorId(), AlertStatus.RESOLVED,
                    current.getLastTriggerTime(), current.getLastDeviation(), current.getSeverity(), now);
            return new TransitionOutcome(AlertTransition.RESOLVED, current, resolved);
        }
        return new TransitionOutcome(AlertTransition.UNCHANGED, current, current);
    }
}
