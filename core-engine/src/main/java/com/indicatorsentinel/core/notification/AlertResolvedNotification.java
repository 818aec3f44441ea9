package com.indicatorsentinel.core.notification;

import java.time.Instant;
import java.util.Objects;

/**
 * Emitted when an active alert returns to normal.
 *
 * @since 1.0.0
 */
public final class AlertResolvedNotification {

    private final int indicatorId;
    private final Instant resolvedTime;

    public AlertResolvedNotification(int indicatorId, Instant resolvedTime) {
        this.indicatorId = indicatorId;
        this.resolvedTime = Objects.requireNonNull(resolvedTime, "resolvedTime must not be null");
    }

    public int getIndicatorId() {
        return indicatorId;
    }

    public Instant getResolvedTime() {
        return resolvedTime;
    }

    @Override
    public String toString() {
        return "AlertResolvedNotification{indicatorId=" + indicatorId + ", resolvedTime=" + resolvedTime + '}';
    }
}
