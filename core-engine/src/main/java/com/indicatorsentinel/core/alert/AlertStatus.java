package com.indicatorsentinel.core.alert;

/**
 * Lifecycle of the single current alert per indicator:
 * {@code NONE -> TRIGGERED -> RESOLVED -> TRIGGERED ...}.
 *
 * @since 1.0.0
 */
public enum AlertStatus {
    NONE,
    TRIGGERED,
    RESOLVED
}
