package com.indicatorsentinel.core.notification;

/**
 * Outbound publisher of alert transitions.
 *
 * <p>
 * Calls are fire-and-forget from the engine's perspective: delivery and retry
 * are the implementation's responsibility, and any exception thrown here is
 * logged by the caller without rolling back the recorded state.
 * </p>
 */
public interface Notifier {

    void alertTriggered(AlertTriggeredNotification notification);

    void alertResolved(AlertResolvedNotification notification);
}
