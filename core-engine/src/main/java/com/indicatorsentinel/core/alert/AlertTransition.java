package com.indicatorsentinel.core.alert;

/**
 * What a call to {@link AlertStateStore#transition} did to an indicator's
 * alert state.
 *
 * @since 1.0.0
 */
public enum AlertTransition {

    /** A new breach episode started. The only transition that warrants a new-alert notification. */
    TRIGGERED,

    /** The breach persists; deviation and severity were refreshed in place. */
    UPDATED,

    /** An active alert returned to normal. */
    RESOLVED,

    /** No change. */
    UNCHANGED
}
