/**
 * Due-indicator selection, per-indicator leases and the recurring tick.
 *
 * <p>
 * The {@link com.indicatorsentinel.core.schedule.LeaseRegistry} is the only
 * mutable state shared between concurrent runs.
 * </p>
 *
 * @since 1.0.0
 */
package com.indicatorsentinel.core.schedule;
