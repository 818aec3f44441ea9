package com.indicatorsentinel.core.dashboard;

import com.indicatorsentinel.core.alert.AlertState;
import com.indicatorsentinel.core.alert.AlertStateStore;
import com.indicatorsentinel.core.ledger.ExecutionLedger;
import com.indicatorsentinel.core.ledger.ExecutionRecord;
import com.indicatorsentinel.core.model.Indicator;
import com.indicatorsentinel.core.schedule.Lease;
import com.indicatorsentinel.core.schedule.LeaseRegistry;
import com.indicatorsentinel.core.store.IndicatorStore;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Computes {@link DashboardSnapshot}s.
 *
 * <p>
 * {@link #aggregate(Instant, Duration)} reads each source exactly once and
 * then derives every figure from those copies with
 * {@link #compute(Instant, Duration, Collection, Collection, Collection, Collection)},
 * so no figure can mix two different views of the same source. Alert states
 * are only counted for indicators that are active in the same copy.
 * </p>
 *
 * @since 1.0.0
 */
public class DashboardAggregator {

    static final int RECENT_EXECUTIONS = 10;

    private final IndicatorStore indicatorStore;
    private final ExecutionLedger ledger;
    private final AlertStateStore alertStore;
    private final LeaseRegistry leases;

    public DashboardAggregator(IndicatorStore indicatorStore, ExecutionLedger ledger,
            AlertStateStore alertStore, LeaseRegistry leases) {
        this.indicatorStore = Objects.requireNonNull(indicatorStore, "indicatorStore must not be null");
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.alertStore = Objects.requireNonNull(alertStore, "alertStore must not be null");
        this.leases = Objects.requireNonNull(leases, "leases must not be null");
    }

    /**
     * @param now    snapshot time
     * @param window look-back window for executions and alerts
     * @return the snapshot
     */
    public DashboardSnapshot aggregate(Instant now, Duration window) {
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(window, "window must not be null");
        List<Indicator> indicators = indicatorStore.findAll();
        List<ExecutionRecord> executions = ledger.between(now.minus(window), now);
        List<AlertState> alerts = alertStore.snapshot();
        List<Lease> running = leases.activeLeases();
        return compute(now, window, indicators, executions, alerts, running);
    }

    /**
     * Pure aggregation over already-captured inputs.
     */
    public static DashboardSnapshot compute(Instant now, Duration window, Collection<Indicator> indicators,
            Collection<ExecutionRecord> executions, Collection<AlertState> alerts, Collection<Lease> running) {
        Instant from = now.minus(window);

        Map<Integer, Indicator> active = indicators.stream()
                .filter(Indicator::isActive)
                .collect(Collectors.toMap(Indicator::getId, Function.identity()));
        int activeCount = active.size();
        int dueCount = (int) active.values().stream().filter(i -> i.isDue(now)).count();

        List<ExecutionRecord> inWindow = executions.stream()
                .filter(r -> r.within(from, now))
                .toList();
        int failed = (int) inWindow.stream().filter(r -> !r.isSuccess()).count();
        List<ExecutionRecord> recent = inWindow.stream()
                .sorted(Comparator.comparing(ExecutionRecord::getTimestamp).reversed())
                .limit(RECENT_EXECUTIONS)
                .toList();

        List<AlertState> activeAlerts = alerts.stream()
                .filter(a -> active.containsKey(a.getIndicatorId()))
                .toList();
        Set<Integer> alertedInWindow = activeAlerts.stream()
                .filter(a -> a.triggeredWithin(from, now))
                .map(AlertState::getIndicatorId)
                .collect(Collectors.toSet());
        int inAlert = (int) activeAlerts.stream().filter(AlertState::isTriggered).count();

        Set<Integer> runningIds = running.stream()
                .map(Lease::getIndicatorId)
                .collect(Collectors.toSet());

        double systemLoad = activeCount == 0 ? 0.0 : dueCount * 100.0 / activeCount;
        Double health = activeCount == 0
                ? null
                : (activeCount - alertedInWindow.size()) * 100.0 / activeCount;

        return DashboardSnapshot.builder()
                .generatedAt(now)
                .window(window)
                .totalIndicators(indicators.size())
                .activeIndicators(activeCount)
                .inactiveIndicators(indicators.size() - activeCount)
                .dueIndicators(dueCount)
                .runningIndicators(runningIds.size())
                .executionsInWindow(inWindow.size())
                .failedExecutionsInWindow(failed)
                .alertsInWindow(alertedInWindow.size())
                .indicatorsInAlert(inAlert)
                .systemLoad(systemLoad)
                .healthPercentage(health)
                .recentExecutions(recent)
                .nextDue(nextDue(active.values(), runningIds, now))
                .build();
    }

    private static NextDueIndicator nextDue(Collection<Indicator> active, Set<Integer> runningIds, Instant now) {
        return active.stream()
                .filter(i -> !runningIds.contains(i.getId()))
                .filter(i -> i.nextRunAt() != null && i.nextRunAt().isAfter(now))
                .min(Comparator.comparing(Indicator::nextRunAt).thenComparingInt(Indicator::getId))
                .map(i -> new NextDueIndicator(i.getId(), i.getName(), i.getOwner(), i.nextRunAt(),
                        minutesUntil(now, i.nextRunAt())))
                .orElse(null);
    }

    private static long minutesUntil(Instant now, Instant then) {
        Duration gap = Duration.between(now, then);
        long minutes = gap.toMinutes();
        // round partial minutes up
        return gap.equals(Duration.ofMinutes(minutes)) ? minutes : minutes + 1;
    }
}
