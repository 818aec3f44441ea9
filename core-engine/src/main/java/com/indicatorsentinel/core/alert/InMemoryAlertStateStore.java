package com.indicatorsentinel.core.alert;

import com.indicatorsentinel.core.evaluation.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link AlertStateStore} backed by a {@link ConcurrentHashMap}.
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Transitions run inside {@link ConcurrentMap#compute}, which serializes
 * updates of the same indicator while leaving other indicators independent.
 * A row is only created by the first alerting evaluation. An evaluation
 * older than the row's last trigger or resolution is ignored, so a late run
 * cannot overwrite a newer state.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryAlertStateStore implements AlertStateStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryAlertStateStore.class);

    private final ConcurrentMap<Integer, AlertState> states = new ConcurrentHashMap<>();

    @Override
    public AlertState get(int indicatorId) {
        return states.getOrDefault(indicatorId, AlertState.none(indicatorId));
    }

    @Override
    public List<AlertState> snapshot() {
        return states.values().stream()
                .sorted(Comparator.comparingInt(AlertState::getIndicatorId))
                .toList();
    }

    @Override
    public TransitionOutcome transition(int indicatorId, boolean shouldAlert, Severity severity,
            Double deviation, Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        AtomicReference<TransitionOutcome> outcome = new AtomicReference<>();

        states.compute(indicatorId, (id, stored) -> {
            if (stored != null && stored.lastChangedAt() != null && now.isBefore(stored.lastChangedAt())) {
                outcome.set(new TransitionOutcome(AlertTransition.UNCHANGED, stored, stored));
                return stored;
            }
            AlertState current = stored != null ? stored : AlertState.none(id);
            TransitionOutcome result = AlertStateMachine.apply(current, shouldAlert, severity, deviation, now);
            outcome.set(result);
            if (stored == null && result.getTransition() == AlertTransition.UNCHANGED) {
                return null;
            }
            return result.getCurrent();
        });

        TransitionOutcome result = outcome.get();
        if (result.getTransition() == AlertTransition.UNCHANGED && result.getCurrent().lastChangedAt() != null
                && now.isBefore(result.getCurrent().lastChangedAt())) {
            LOG.warn("Ignoring evaluation of indicator {} at {}: state already changed at {}",
                    indicatorId, now, result.getCurrent().lastChangedAt());
        }
        switch (result.getTransition()) {
            case TRIGGERED -> LOG.info("Alert triggered: indicator={} severity={} deviation={}",
                    indicatorId, severity, deviation);
            case RESOLVED -> LOG.info("Alert resolved: indicator={}", indicatorId);
            case UPDATED -> LOG.debug("Alert still active, repeat notification suppressed: indicator={} severity={}",
                    indicatorId, severity);
            default -> {
                // nothing changed
            }
        }
        return result;
    }
}
