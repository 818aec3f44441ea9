package com.indicatorsentinel.core.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-indicator execution leases.
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Acquisition is a single {@link ConcurrentMap#putIfAbsent} and release a
 * single {@link ConcurrentMap#remove(Object, Object)}, so two overlapping ticks
 * can never both hold the same indicator. A lease lives for
 * {@code ttl}; after that {@link #reclaimExpired(Instant)} frees it so a
 * stuck run cannot starve its indicator forever.
 * </p>
 *
 * @since 1.0.0
 */
public class LeaseRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(LeaseRegistry.class);

    private final ConcurrentMap<Integer, Lease> leases = new ConcurrentHashMap<>();
    private final Duration ttl;

    /**
     * @param ttl lifetime of a lease; usually the collection timeout plus a
     *            grace period
     */
    public LeaseRegistry(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive, got " + ttl);
        }
        this.ttl = ttl;
    }

    /**
     * Atomically claim an indicator.
     *
     * @param indicatorId indicator to claim
     * @param now         acquisition time
     * @return the new lease, or empty when another run already holds one
     */
    public Optional<Lease> tryAcquire(int indicatorId, Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        Lease candidate = new Lease(indicatorId, UUID.randomUUID(), now, now.plus(ttl));
        Lease existing = leases.putIfAbsent(indicatorId, candidate);
        if (existing != null) {
            LOG.debug("Indicator {} is already leased until {}", indicatorId, existing.getExpiresAt());
            return Optional.empty();
        }
        return Optional.of(candidate);
    }

    /**
     * Release a lease. Releasing a lease that was already reclaimed (or
     * replaced by a newer one) is a no-op.
     *
     * @return {@code true} if this exact lease was held and is now released
     */
    public boolean release(Lease lease) {
        Objects.requireNonNull(lease, "lease must not be null");
        return leases.remove(lease.getIndicatorId(), lease);
    }

    /**
     * Remove every lease whose expiry has passed.
     *
     * @param now current time
     * @return the reclaimed leases
     */
    public List<Lease> reclaimExpired(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        List<Lease> reclaimed = new ArrayList<>();
        for (Lease lease : leases.values()) {
            if (lease.isExpired(now) && leases.remove(lease.getIndicatorId(), lease)) {
                reclaimed.add(lease);
            }
        }
        return reclaimed;
    }

    /** Snapshot of held leases, ordered by indicator id. */
    public List<Lease> activeLeases() {
        return leases.values().stream()
                .sorted(Comparator.comparingInt(Lease::getIndicatorId))
                .toList();
    }

    public boolean isLeased(int indicatorId) {
        return leases.containsKey(indicatorId);
    }

    public int size() {
        return leases.size();
    }

    public Duration getTtl() {
        return ttl;
    }
}
