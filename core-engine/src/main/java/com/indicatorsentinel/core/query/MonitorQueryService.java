package com.indicatorsentinel.core.query;

import com.indicatorsentinel.core.alert.AlertState;
import com.indicatorsentinel.core.alert.AlertStateStore;
import com.indicatorsentinel.core.dashboard.DashboardAggregator;
import com.indicatorsentinel.core.dashboard.DashboardSnapshot;
import com.indicatorsentinel.core.ledger.ExecutionLedger;
import com.indicatorsentinel.core.ledger.ExecutionQuery;
import com.indicatorsentinel.core.ledger.ExecutionRecord;
import com.indicatorsentinel.core.model.Indicator;
import com.indicatorsentinel.core.schedule.DispatchOrder;
import com.indicatorsentinel.core.schedule.Lease;
import com.indicatorsentinel.core.schedule.LeaseRegistry;
import com.indicatorsentinel.core.store.IndicatorStore;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Read-only view of the engine for an outer layer (web, CLI, health probe).
 *
 * <p>
 * Every method reads current state; nothing here changes schedules, leases
 * or alert states.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitorQueryService {

    private final IndicatorStore indicatorStore;
    private final ExecutionLedger ledger;
    private final AlertStateStore alertStore;
    private final LeaseRegistry leases;
    private final DashboardAggregator aggregator;
    private final Clock clock;

    public MonitorQueryService(IndicatorStore indicatorStore, ExecutionLedger ledger, AlertStateStore alertStore,
            LeaseRegistry leases, Clock clock) {
        this.indicatorStore = Objects.requireNonNull(indicatorStore, "indicatorStore must not be null");
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.alertStore = Objects.requireNonNull(alertStore, "alertStore must not be null");
        this.leases = Objects.requireNonNull(leases, "leases must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.aggregator = new DashboardAggregator(indicatorStore, ledger, alertStore, leases);
    }

    /** Active indicators due right now, in dispatch order. */
    public List<Indicator> dueIndicators() {
        return DispatchOrder.dueIndicators(indicatorStore.findActive(), clock.instant());
    }

    /**
     * @param query filter; see {@link ExecutionQuery}
     * @return matching records, newest first
     */
    public List<ExecutionRecord> executionHistory(ExecutionQuery query) {
        return ledger.query(Objects.requireNonNull(query, "query must not be null"));
    }

    public DashboardSnapshot dashboard(Duration window) {
        return aggregator.aggregate(clock.instant(), window);
    }

    public AlertState alertState(int indicatorId) {
        return alertStore.get(indicatorId);
    }

    /** Indicators whose alert is currently active, ordered by id. */
    public List<AlertState> triggeredAlerts() {
        return alertStore.snapshot().stream()
                .filter(AlertState::isTriggered)
                .toList();
    }

    /** Runs currently in flight. */
    public List<Lease> runningExecutions() {
        return leases.activeLeases();
    }
}
