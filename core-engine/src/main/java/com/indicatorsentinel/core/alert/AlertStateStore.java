package com.indicatorsentinel.core.alert;

import com.indicatorsentinel.core.evaluation.Severity;

import java.time.Instant;
import java.util.List;

/**
 * Holds the current alert state per indicator.
 *
 * <p>
 * State is written only through {@link #transition}, which must be atomic per
 * indicator: concurrent calls for the same indicator are serialized as
 * compare-and-update operations, never blind overwrites.
 * </p>
 */
public interface AlertStateStore {

    /**
     * @param indicatorId the indicator
     * @return the stored state, or {@link AlertState#none(int)} if the
     *         indicator has never alerted
     */
    AlertState get(int indicatorId);

    /**
     * @return point-in-time copy of every stored state
     */
    List<AlertState> snapshot();

    /**
     * Apply an evaluation to the indicator's alert state. See
     * {@link AlertStateMachine} for the rules.
     *
     * @param indicatorId the indicator
     * @param shouldAlert evaluator decision
     * @param severity    evaluator severity
     * @param deviation   evaluator deviation, may be {@code null}
     * @param now         transition time
     * @return what changed
     */
    TransitionOutcome transition(int indicatorId, boolean shouldAlert, Severity severity,
            Double deviation, Instant now);
}
