package com.indicatorsentinel.core.schedule;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Exclusive, time-bounded claim on one indicator's execution.
 *
 * <p>
 * Two leases are equal only when they carry the same token, so a holder whose
 * lease was reclaimed can never release a newer lease for the same indicator.
 * </p>
 *
 * @since 1.0.0
 */
public final class Lease {

    private final int indicatorId;
    private final UUID token;
    private final Instant acquiredAt;
    private final Instant expiresAt;

    Lease(int indicatorId, UUID token, Instant acquiredAt, Instant expiresAt) {
        this.indicatorId = indicatorId;
        this.token = Objects.requireNonNull(token, "token must not be null");
        this.acquiredAt = Objects.requireNonNull(acquiredAt, "acquiredAt must not be null");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt must not be null");
    }

    /**
     * @param now current time
     * @return {@code true} once {@code now} has reached the expiry instant
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public int getIndicatorId() {
        return indicatorId;
    }

    public UUID getToken() {
        return token;
    }

    public Instant getAcquiredAt() {
        return acquiredAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Lease)) {
            return false;
        }
        Lease other = (Lease) o;
        return indicatorId == other.indicatorId && token.equals(other.token);
    }

    @Override
    public int hashCode() {
        return Objects.hash(indicatorId, token);
    }

    @Override
    public String toString() {
        return "Lease{" +
                "indicatorId=" + indicatorId +
                ", token=" + token +
                ", acquiredAt=" + acquiredAt +
                ", expiresAt=" + expiresAt +
                '}';
    }
}
