package com.indicatorsentinel.core.dashboard;

import java.time.Instant;
import java.util.Objects;

/**
 * The indicator whose next run comes soonest.
 *
 * @since 1.0.0
 */
public final class NextDueIndicator {

    /** Runs due within this many minutes are reported as {@link Status#DUE_SOON}. */
    public static final long DUE_SOON_MINUTES = 5;

    public enum Status {
        DUE_SOON,
        SCHEDULED
    }

    private final int indicatorId;
    private final String name;
    private final String owner;
    private final Instant nextRunAt;
    private final long minutesUntilDue;
    private final Status status;

    public NextDueIndicator(int indicatorId, String name, String owner, Instant nextRunAt, long minutesUntilDue) {
        this.indicatorId = indicatorId;
        this.name = name;
        this.owner = owner;
        this.nextRunAt = Objects.requireNonNull(nextRunAt, "nextRunAt must not be null");
        this.minutesUntilDue = minutesUntilDue;
        this.status = minutesUntilDue <= DUE_SOON_MINUTES ? Status.DUE_SOON : Status.SCHEDULED;
    }

    public int getIndicatorId() {
        return indicatorId;
    }

    public String getName() {
        return name;
    }

    public String getOwner() {
        return owner;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    public long getMinutesUntilDue() {
        return minutesUntilDue;
    }

    public Status getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return "NextDueIndicator{" +
                "indicatorId=" + indicatorId +
                ", name='" + name + '\'' +
                ", nextRunAt=" + nextRunAt +
                ", minutesUntilDue=" + minutesUntilDue +
                ", status=" + status +
                '}';
    }
}
