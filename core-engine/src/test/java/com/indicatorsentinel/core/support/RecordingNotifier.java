package com.indicatorsentinel.core.support;

import com.indicatorsentinel.core.notification.AlertResolvedNotification;
import com.indicatorsentinel.core.notification.AlertTriggeredNotification;
import com.indicatorsentinel.core.notification.Notifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Notifier that keeps every call for later assertions, optionally failing.
 */
public class RecordingNotifier implements Notifier {

    public final List<AlertTriggeredNotification> triggered = new CopyOnWriteArrayList<>();
    public final List<AlertResolvedNotification> resolved = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    public void failWith(boolean failing) {
        this.failing = failing;
    }

    @Override
    public void alertTriggered(AlertTriggeredNotification notification) {
        triggered.add(notification);
        if (failing) {
            throw new IllegalStateException("notification channel down");
        }
    }

    @Override
    public void alertResolved(AlertResolvedNotification notification) {
        resolved.add(notification);
        if (failing) {
            throw new IllegalStateException("notification channel down");
        }
    }
}
