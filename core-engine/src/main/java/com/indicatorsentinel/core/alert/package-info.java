/**
 * Per-indicator alert lifecycle.
 *
 * <p>
 * {@link com.indicatorsentinel.core.alert.AlertStateMachine} defines the
 * transitions; {@link com.indicatorsentinel.core.alert.AlertStateStore}
 * applies them atomically per indicator. A repeat breach while an alert is
 * already active refreshes the state but is not reported as a new alert.
 * </p>
 *
 * @since 1.0.0
 */
package com.indicatorsentinel.core.alert;
