package com.indicatorsentinel.core.schedule;

import com.indicatorsentinel.core.execution.IndicatorExecutor;
import com.indicatorsentinel.core.metrics.MonitorMetrics;
import com.indicatorsentinel.core.model.Indicator;
import com.indicatorsentinel.core.store.IndicatorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Selects due indicators, leases them and dispatches their runs to a bounded
 * worker pool.
 *
 * <h3>Dispatch Rules</h3>
 * <ol>
 * <li>Expired leases are reclaimed first.</li>
 * <li>Due indicators are taken in {@link DispatchOrder}.</li>
 * <li>An indicator whose lease is held by a previous run is skipped; it stays
 * due and is picked up once the lease is released.</li>
 * <li>Once leased, the indicator is re-read and dispatched only if it is still
 * active and due.</li>
 * <li>At most {@code maxConcurrent} runs are in flight. Due indicators beyond
 * that are deferred to a later tick.</li>
 * <li>The lease is released when the run ends, whatever the outcome.</li>
 * </ol>
 *
 * <p>
 * {@link #tick(Instant)} may be called concurrently; lease acquisition keeps
 * two ticks from dispatching the same indicator.
 * </p>
 *
 * @since 1.0.0
 */
public class IndicatorScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(IndicatorScheduler.class);

    private final IndicatorStore indicatorStore;
    private final LeaseRegistry leases;
    private final IndicatorExecutor executor;
    private final ExecutorService workers;
    private final int maxConcurrent;
    private final MonitorMetrics metrics;
    private final Clock clock;

    /**
     * @param indicatorStore source of indicator definitions
     * @param leases         lease registry shared with the dashboard and query
     *                       surface
     * @param executor       runs a single indicator
     * @param workers        pool that executes runs
     * @param maxConcurrent  upper bound on runs in flight; normally the pool
     *                       size
     * @param metrics        meters to update
     * @param clock          time source
     */
    public IndicatorScheduler(IndicatorStore indicatorStore, LeaseRegistry leases, IndicatorExecutor executor,
            ExecutorService workers, int maxConcurrent, MonitorMetrics metrics, Clock clock) {
        this.indicatorStore = Objects.requireNonNull(indicatorStore, "indicatorStore must not be null");
        this.leases = Objects.requireNonNull(leases, "leases must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.workers = Objects.requireNonNull(workers, "workers must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1, got " + maxConcurrent);
        }
        this.maxConcurrent = maxConcurrent;
        metrics.bindActiveLeases(leases::size);
    }

    /**
     * @param now evaluation time
     * @return active indicators whose interval has elapsed, in dispatch order
     */
    public List<Indicator> dueIndicators(Instant now) {
        return DispatchOrder.dueIndicators(indicatorStore.findActive(), now);
    }

    /** Run one tick at the clock's current time. */
    public TickResult tick() {
        return tick(clock.instant());
    }

    /**
     * Run one tick.
     *
     * @param now tick time used for the due predicate and lease acquisition
     * @return what was dispatched, skipped, deferred and reclaimed
     */
    public TickResult tick(Instant now) {
        Objects.requireNonNull(now, "now must not be null");

        List<Lease> reclaimed = leases.reclaimExpired(now);
        for (Lease lease : reclaimed) {
            LOG.warn("Reclaimed stuck lease: indicator={} acquiredAt={} expiredAt={}",
                    lease.getIndicatorId(), lease.getAcquiredAt(), lease.getExpiresAt());
        }

        List<Integer> dispatched = new ArrayList<>();
        List<Integer> skipped = new ArrayList<>();
        List<Integer> deferred = new ArrayList<>();

        for (Indicator indicator : dueIndicators(now)) {
            if (leases.size() >= maxConcurrent) {
                deferred.add(indicator.getId());
                continue;
            }
            Optional<Lease> lease = leases.tryAcquire(indicator.getId(), now);
            if (lease.isEmpty()) {
                LOG.debug("Skipping indicator {}: previous run still in flight", indicator.getId());
                metrics.incrementDispatchSkipped();
                skipped.add(indicator.getId());
                continue;
            }
            // the due list may be stale if a run finished after it was read
            Optional<Indicator> current = indicatorStore.findById(indicator.getId())
                    .filter(Indicator::isActive)
                    .filter(i -> i.isDue(now));
            if (current.isEmpty()) {
                leases.release(lease.get());
                LOG.debug("Indicator {} is no longer due, not dispatching", indicator.getId());
                continue;
            }
            if (submit(current.get(), lease.get())) {
                dispatched.add(indicator.getId());
            } else {
                deferred.add(indicator.getId());
            }
        }

        TickResult result = new TickResult(now, dispatched, skipped, deferred, reclaimed);
        if (!result.isIdle()) {
            LOG.info("Tick at {}: dispatched={} skipped={} deferred={} reclaimed={}",
                    now, dispatched, skipped, deferred, reclaimed.size());
        }
        return result;
    }

    // ----------------------------------------------------------------
    // Internal
    // ----------------------------------------------------------------

    private boolean submit(Indicator indicator, Lease lease) {
        try {
            workers.execute(() -> runLeased(indicator, lease));
            return true;
        } catch (RejectedExecutionException e) {
            leases.release(lease);
            LOG.warn("Worker pool rejected indicator {}; will retry on a later tick", indicator.getId());
            return false;
        }
    }

    private void runLeased(Indicator indicator, Lease lease) {
        try {
            executor.run(indicator, clock.instant());
        } catch (RuntimeException e) {
            LOG.error("Run of indicator {} ({}) failed", indicator.getId(), indicator.getName(), e);
        } finally {
            if (!leases.release(lease)) {
                LOG.warn("Lease for indicator {} was reclaimed before its run finished", indicator.getId());
            }
        }
    }
}
