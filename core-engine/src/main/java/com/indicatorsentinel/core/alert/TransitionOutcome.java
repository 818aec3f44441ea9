package com.indicatorsentinel.core.alert;

import java.util.Objects;

/**
 * Result of applying one evaluation to an indicator's alert state.
 *
 * @since 1.0.0
 */
public final class TransitionOutcome {

    private final AlertTransition transition;
    private final AlertState previous;
    private final AlertState current;

    public TransitionOutcome(AlertTransition transition, AlertState previous, AlertState current) {
        this.transition = Objects.requireNonNull(transition, "transition must not be null");
        this.previous = Objects.requireNonNull(previous, "previous must not be null");
        this.current = Objects.requireNonNull(current, "current must not be null");
    }

    public AlertTransition getTransition() {
        return transition;
    }

    public AlertState getPrevious() {
        return previous;
    }

    public AlertState getCurrent() {
        return current;
    }

    public boolean isNewAlert() {
        return transition == AlertTransition.TRIGGERED;
    }

    public boolean isResolution() {
        return transition == AlertTransition.RESOLVED;
    }

    @Override
    public String toString() {
        return "TransitionOutcome{" + transition + ", current=" + current + '}';
    }
}
