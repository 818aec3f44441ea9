package com.indicatorsentinel.core.execution;

import com.indicatorsentinel.core.alert.AlertStateStore;
import com.indicatorsentinel.core.alert.TransitionOutcome;
import com.indicatorsentinel.core.collector.CollectionException;
import com.indicatorsentinel.core.collector.CollectionResult;
import com.indicatorsentinel.core.collector.MetricCollector;
import com.indicatorsentinel.core.evaluation.EvaluationResult;
import com.indicatorsentinel.core.evaluation.Evaluator;
import com.indicatorsentinel.core.ledger.ExecutionLedger;
import com.indicatorsentinel.core.ledger.ExecutionRecord;
import com.indicatorsentinel.core.metrics.MonitorMetrics;
import com.indicatorsentinel.core.model.Indicator;
import com.indicatorsentinel.core.notification.AlertResolvedNotification;
import com.indicatorsentinel.core.notification.AlertTriggeredNotification;
import com.indicatorsentinel.core.notification.Notifier;
import com.indicatorsentinel.core.store.IndicatorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one indicator: collect, evaluate, record, transition the alert state
 * and notify.
 *
 * <h3>Failure Isolation</h3>
 * <ul>
 * <li>Collector error or timeout, or a collection pool that rejects the
 * task: a failed record is appended, the indicator's last run is advanced,
 * and evaluation and alerting are skipped.</li>
 * <li>Evaluator error: logged and treated as "no alert".</li>
 * <li>Notifier error: logged; the ledger entry and alert state stay.</li>
 * <li>Ledger or store errors propagate to the caller.</li>
 * </ul>
 *
 * <p>
 * The collector runs on {@code collectionPool} so that the worker thread can
 * stop waiting once the timeout elapses. The timed-out collector task is
 * interrupted.
 * </p>
 *
 * @since 1.0.0
 */
public class IndicatorExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(IndicatorExecutor.class);

    public static final Duration DEFAULT_COLLECTION_TIMEOUT = Duration.ofSeconds(30);

    private final MetricCollector collector;
    private final Evaluator evaluator;
    private final ExecutionLedger ledger;
    private final IndicatorStore indicatorStore;
    private final AlertStateStore alertStore;
    private final Notifier notifier;
    private final MonitorMetrics metrics;
    private final ExecutorService collectionPool;
    private final Duration collectionTimeout;

    private IndicatorExecutor(Builder builder) {
        this.collector = builder.collector;
        this.evaluator = builder.evaluator;
        this.ledger = builder.ledger;
        this.indicatorStore = builder.indicatorStore;
        this.alertStore = builder.alertStore;
        this.notifier = builder.notifier;
        this.metrics = builder.metrics;
        this.collectionPool = builder.collectionPool;
        this.collectionTimeout = builder.collectionTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Execute one run of {@code indicator}.
     *
     * @param indicator indicator to run
     * @param now       run time; stamped on the record, used as the new last
     *                  run and as the alert transition time
     * @return the record appended to the ledger
     */
    public ExecutionRecord run(Indicator indicator, Instant now) {
        Objects.requireNonNull(indicator, "indicator must not be null");
        Objects.requireNonNull(now, "now must not be null");
        long started = System.nanoTime();

        CollectionResult collected;
        try {
            collected = collect(indicator, now.plus(collectionTimeout));
        } catch (CollectionException e) {
            return recordFailure(indicator, now, e.getMessage(), started);
        }
        if (!collected.isOk()) {
            return recordFailure(indicator, now, collected.getError(), started);
        }

        EvaluationResult evaluation = evaluate(indicator, collected);
        ExecutionRecord record = ExecutionRecord.builder()
                .indicatorId(indicator.getId())
                .timestamp(now)
                .currentValue(collected.getCurrentValue())
                .baselineValue(collected.getBaselineValue())
                .deviationPercent(evaluation.getDeviationPercent())
                .success(true)
                .duration(elapsedSince(started))
                .build();

        ledger.append(record);
        indicatorStore.updateLastRun(indicator.getId(), now);

        TransitionOutcome outcome = alertStore.transition(indicator.getId(), evaluation.shouldAlert(),
                evaluation.getSeverity(), evaluation.getDeviationPercent(), now);
        publish(indicator, collected, outcome);

        metrics.recordExecution(true, record.getDuration());
        LOG.debug("Indicator {} ran: current={} baseline={} deviation={} alert={}",
                indicator.getId(), collected.getCurrentValue(), collected.getBaselineValue(),
                evaluation.getDeviationPercent(), evaluation.shouldAlert());
        return record;
    }

    // ----------------------------------------------------------------
    // Steps
    // ----------------------------------------------------------------

    private CollectionResult collect(Indicator indicator, Instant deadline) {
        Future<CollectionResult> future;
        try {
            future = collectionPool.submit(
                    () -> collector.collect(indicator.getSourceRef(), indicator.windowMinutes(), deadline));
        } catch (RejectedExecutionException e) {
            throw new CollectionException("Collection pool rejected " + indicator.getSourceRef(), e);
        }
        try {
            CollectionResult result = future.get(collectionTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                throw new CollectionException("Collector returned no result for " + indicator.getSourceRef());
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CollectionException("Collection timed out after " + collectionTimeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CollectionException collectionError) {
                throw collectionError;
            }
            throw new CollectionException("Collector failed: " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new CollectionException("Interrupted while collecting " + indicator.getSourceRef(), e);
        }
    }

    private EvaluationResult evaluate(Indicator indicator, CollectionResult collected) {
        try {
            return evaluator.evaluate(indicator, collected.getCurrentValue(), collected.getBaselineValue());
        } catch (RuntimeException e) {
            LOG.warn("Evaluation of indicator {} failed, treating as no alert: {}",
                    indicator.getId(), e.getMessage(), e);
            return EvaluationResult.indeterminate();
        }
    }

    private ExecutionRecord recordFailure(Indicator indicator, Instant now, String error, long started) {
        String message = error != null && !error.isBlank() ? error : "Collection failed";
        LOG.warn("Collection for indicator {} ({}) failed: {}", indicator.getId(), indicator.getName(), message);

        ExecutionRecord record = ExecutionRecord.builder()
                .indicatorId(indicator.getId())
                .timestamp(now)
                .success(false)
                .errorMessage(message)
                .duration(elapsedSince(started))
                .build();
        ledger.append(record);
        indicatorStore.updateLastRun(indicator.getId(), now);
        metrics.recordExecution(false, record.getDuration());
        return record;
    }

    private void publish(Indicator indicator, CollectionResult collected, TransitionOutcome outcome) {
        try {
            if (outcome.isNewAlert()) {
                metrics.incrementAlertsTriggered();
                notifier.alertTriggered(new AlertTriggeredNotification(
                        indicator.getId(),
                        indicator.getName(),
                        indicator.getOwner(),
                        outcome.getCurrent().getSeverity(),
                        collected.getCurrentValue(),
                        collected.getBaselineValue(),
                        outcome.getCurrent().getLastDeviation(),
                        outcome.getCurrent().getLastTriggerTime()));
            } else if (outcome.isResolution()) {
                metrics.incrementAlertsResolved();
                notifier.alertResolved(new AlertResolvedNotification(
                        indicator.getId(), outcome.getCurrent().getResolvedTime()));
            }
        } catch (RuntimeException e) {
            LOG.error("Notification for indicator {} ({}) failed; alert state is kept",
                    indicator.getId(), outcome.getTransition(), e);
        }
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    // ----------------------------------------------------------------
    // Builder
    // ----------------------------------------------------------------

    public static class Builder {
        private MetricCollector collector;
        private Evaluator evaluator = new Evaluator();
        private ExecutionLedger ledger;
        private IndicatorStore indicatorStore;
        private AlertStateStore alertStore;
        private Notifier notifier;
        private MonitorMetrics metrics;
        private ExecutorService collectionPool;
        private Duration collectionTimeout = DEFAULT_COLLECTION_TIMEOUT;

        private Builder() {
        }

        public Builder collector(MetricCollector collector) {
            this.collector = collector;
            return this;
        }

        public Builder evaluator(Evaluator evaluator) {
            this.evaluator = evaluator;
            return this;
        }

        public Builder ledger(ExecutionLedger ledger) {
            this.ledger = ledger;
            return this;
        }

        public Builder indicatorStore(IndicatorStore indicatorStore) {
            this.indicatorStore = indicatorStore;
            return this;
        }

        public Builder alertStore(AlertStateStore alertStore) {
            this.alertStore = alertStore;
            return this;
        }

        public Builder notifier(Notifier notifier) {
            this.notifier = notifier;
            return this;
        }

        public Builder metrics(MonitorMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder collectionPool(ExecutorService collectionPool) {
            this.collectionPool = collectionPool;
            return this;
        }

        public Builder collectionTimeout(Duration collectionTimeout) {
            this.collectionTimeout = collectionTimeout;
            return this;
        }

        public IndicatorExecutor build() {
            Objects.requireNonNull(collector, "collector must not be null");
            Objects.requireNonNull(evaluator, "evaluator must not be null");
            Objects.requireNonNull(ledger, "ledger must not be null");
            Objects.requireNonNull(indicatorStore, "indicatorStore must not be null");
            Objects.requireNonNull(alertStore, "alertStore must not be null");
            Objects.requireNonNull(notifier, "notifier must not be null");
            Objects.requireNonNull(metrics, "metrics must not be null");
            Objects.requireNonNull(collectionPool, "collectionPool must not be null");
            Objects.requireNonNull(collectionTimeout, "collectionTimeout must not be null");
            if (collectionTimeout.isZero() || collectionTimeout.isNegative()) {
                throw new IllegalArgumentException("collectionTimeout must be positive, got " + collectionTimeout);
            }
            return new IndicatorExecutor(this);
        }
    }
}
