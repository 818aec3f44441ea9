package com.indicatorsentinel.core.schedule;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one scheduler tick.
 *
 * <ul>
 * <li>{@code dispatched}: indicators leased and submitted for execution</li>
 * <li>{@code skipped}: due indicators whose previous run still holds the
 * lease</li>
 * <li>{@code deferred}: due indicators left for a later tick because every
 * worker slot was taken</li>
 * <li>{@code reclaimed}: stuck leases freed at the start of the tick</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class TickResult {

    private final Instant tickTime;
    private final List<Integer> dispatched;
    private final List<Integer> skipped;
    private final List<Integer> deferred;
    private final List<Lease> reclaimed;

    TickResult(Instant tickTime, List<Integer> dispatched, List<Integer> skipped,
            List<Integer> deferred, List<Lease> reclaimed) {
        this.tickTime = tickTime;
        this.dispatched = List.copyOf(dispatched);
        this.skipped = List.copyOf(skipped);
        this.deferred = List.copyOf(deferred);
        this.reclaimed = List.copyOf(reclaimed);
    }

    public Instant getTickTime() {
        return tickTime;
    }

    public List<Integer> getDispatched() {
        return dispatched;
    }

    public List<Integer> getSkipped() {
        return skipped;
    }

    public List<Integer> getDeferred() {
        return deferred;
    }

    public List<Lease> getReclaimed() {
        return reclaimed;
    }

    public boolean isIdle() {
        return dispatched.isEmpty() && skipped.isEmpty() && deferred.isEmpty() && reclaimed.isEmpty();
    }

    @Override
    public String toString() {
        return "TickResult{" +
                "tickTime=" + tickTime +
                ", dispatched=" + dispatched +
                ", skipped=" + skipped +
                ", deferred=" + deferred +
                ", reclaimed=" + reclaimed.size() +
                '}';
    }
}
