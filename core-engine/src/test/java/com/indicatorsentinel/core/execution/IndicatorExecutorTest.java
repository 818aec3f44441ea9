package com.indicatorsentinel.core.execution;

import com.indicatorsentinel.core.alert.AlertStatus;
import com.indicatorsentinel.core.alert.InMemoryAlertStateStore;
import com.indicatorsentinel.core.collector.CollectionException;
import com.indicatorsentinel.core.collector.CollectionResult;
import com.indicatorsentinel.core.evaluation.EvaluationResult;
import com.indicatorsentinel.core.evaluation.Evaluator;
import com.indicatorsentinel.core.evaluation.Severity;
import com.indicatorsentinel.core.ledger.ExecutionLedger;
import com.indicatorsentinel.core.ledger.ExecutionQuery;
import com.indicatorsentinel.core.ledger.ExecutionRecord;
import com.indicatorsentinel.core.ledger.InMemoryExecutionLedger;
import com.indicatorsentinel.core.metrics.MonitorMetrics;
import com.indicatorsentinel.core.model.ComparisonOperator;
import com.indicatorsentinel.core.model.Indicator;
import com.indicatorsentinel.core.notification.AlertTriggeredNotification;
import com.indicatorsentinel.core.store.InMemoryIndicatorStore;
import com.indicatorsentinel.core.support.RecordingNotifier;
import com.indicatorsentinel.core.support.ScriptedCollector;
import com.indicatorsentinel.core.support.TestIndicators;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link IndicatorExecutor}.
 */
class IndicatorExecutorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");
    private static final Instant T1 = T0.plus(Duration.ofMinutes(5));
    private static final Instant T2 = T1.plus(Duration.ofMinutes(5));

    private final ScriptedCollector collector = new ScriptedCollector();
    private final InMemoryExecutionLedger ledger = new InMemoryExecutionLedger();
    private final InMemoryAlertStateStore alerts = new InMemoryAlertStateStore();
    private final RecordingNotifier notifier = new RecordingNotifier();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final ExecutorService collectionPool = Executors.newCachedThreadPool();

    private InMemoryIndicatorStore store;
    private Indicator rate;

    @BeforeEach
    void setUp() {
        rate = TestIndicators.successRate(1, 15, 10).name("Card approvals").owner("payments").build();
        store = new InMemoryIndicatorStore(List.of(rate));
    }

    @AfterEach
    void tearDown() {
        collector.release();
        collectionPool.shutdownNow();
    }

    @Test
    @DisplayName("Should record, advance last run and notify on a new breach")
    void newBreach() {
        collector.answer("source-1", 70, 100.0);

        ExecutionRecord record = executor().run(rate, T0);

        assertThat(record.isSuccess()).isTrue();
        assertThat(record.getCurrentValue()).isEqualTo(70.0);
        assertThat(record.getBaselineValue()).isEqualTo(100.0);
        assertThat(record.getDeviationPercent()).isCloseTo(-30.0, within(1e-9));
        assertThat(ledger.query(ExecutionQuery.all())).containsExactly(record);
        assertThat(store.findById(1).orElseThrow().getLastRun()).isEqualTo(T0);

        assertThat(notifier.triggered).singleElement().satisfies(n -> {
            assertThat(n.getIndicatorId()).isEqualTo(1);
            assertThat(n.getName()).isEqualTo("Card approvals");
            assertThat(n.getOwner()).isEqualTo("payments");
            assertThat(n.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(n.getCurrentValue()).isEqualTo(70.0);
            assertThat(n.getTriggerTime()).isEqualTo(T0);
        });
        assertThat(registry.get("indicator.alerts.triggered").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("indicator.executions").tag("outcome", "success").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should notify once per breach episode and once on resolution")
    void suppressionAndResolution() {
        IndicatorExecutor executor = executor();

        collector.answer("source-1", 70, 100.0);
        executor.run(rate, T0);
        collector.answer("source-1", 40, 100.0);
        executor.run(rate, T1);

        assertThat(notifier.triggered).hasSize(1);
        assertThat(alerts.get(1).getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(alerts.get(1).getLastTriggerTime()).isEqualTo(T0);

        collector.answer("source-1", 99, 100.0);
        executor.run(rate, T2);

        assertThat(notifier.resolved).singleElement().satisfies(n -> {
            assertThat(n.getIndicatorId()).isEqualTo(1);
            assertThat(n.getResolvedTime()).isEqualTo(T2);
        });
        assertThat(alerts.get(1).getStatus()).isEqualTo(AlertStatus.RESOLVED);
    }

    @Test
    @DisplayName("Should never alert below the minimum threshold")
    void minimumThreshold() {
        collector.answer("source-1", 5, 100.0);

        executor().run(rate, T0);

        assertThat(notifier.triggered).isEmpty();
        assertThat(alerts.get(1).getStatus()).isEqualTo(AlertStatus.NONE);
    }

    @Test
    @DisplayName("Should record a failed run without touching alert state when the collector fails")
    void collectorFailure() {
        collector.answer("source-1", 70, 100.0);
        IndicatorExecutor executor = executor();
        executor.run(rate, T0);

        collector.answer("source-1", () -> CollectionResult.failure("backend unavailable"));
        ExecutionRecord failed = executor.run(rate, T1);

        assertThat(failed.isSuccess()).isFalse();
        assertThat(failed.getErrorMessage()).isEqualTo("backend unavailable");
        assertThat(failed.getDeviationPercent()).isNull();
        assertThat(store.findById(1).orElseThrow().getLastRun()).isEqualTo(T1);
        assertThat(alerts.get(1).getStatus()).isEqualTo(AlertStatus.TRIGGERED);
        assertThat(notifier.resolved).isEmpty();
        assertThat(ledger.size()).isEqualTo(2);
        assertThat(registry.get("indicator.executions").tag("outcome", "failure").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should turn a thrown collector exception into a failed run")
    void collectorThrows() {
        collector.answer("source-1", () -> {
            throw new CollectionException("query rejected");
        });

        ExecutionRecord record = executor().run(rate, T0);

        assertThat(record.isSuccess()).isFalse();
        assertThat(record.getErrorMessage()).isEqualTo("query rejected");
    }

    @Test
    @DisplayName("Should treat an unexpected collector exception as a failed run")
    void collectorThrowsUnexpected() {
        collector.answer("source-1", () -> {
            throw new IllegalStateException("connection reset");
        });

        ExecutionRecord record = executor().run(rate, T0);

        assertThat(record.isSuccess()).isFalse();
        assertThat(record.getErrorMessage()).contains("connection reset");
    }

    @Test
    @DisplayName("Should fail the run when collection exceeds the timeout")
    void timeout() {
        collector.answer("source-1", 70, 100.0).blockUntilReleased();
        IndicatorExecutor executor = IndicatorExecutor.builder()
                .collector(collector)
                .ledger(ledger)
                .indicatorStore(store)
                .alertStore(alerts)
                .notifier(notifier)
                .metrics(new MonitorMetrics(registry))
                .collectionPool(collectionPool)
                .collectionTimeout(Duration.ofMillis(100))
                .build();

        ExecutionRecord record = executor.run(rate, T0);

        assertThat(record.isSuccess()).isFalse();
        assertThat(record.getErrorMessage()).contains("timed out");
        assertThat(store.findById(1).orElseThrow().getLastRun()).isEqualTo(T0);
        assertThat(notifier.triggered).isEmpty();
    }

    @Test
    @DisplayName("Should record a failed run when the collection pool rejects the task")
    void collectionPoolRejects() {
        ExecutorService closedPool = Executors.newSingleThreadExecutor();
        closedPool.shutdown();

        ExecutionRecord record = executorBuilder().collectionPool(closedPool).build().run(rate, T0);

        assertThat(record.isSuccess()).isFalse();
        assertThat(record.getErrorMessage()).contains("rejected");
        assertThat(ledger.size()).isEqualTo(1);
        assertThat(store.findById(1).orElseThrow().getLastRun()).isEqualTo(T0);
        assertThat(collector.calls()).isZero();
        assertThat(registry.get("indicator.executions").tag("outcome", "failure").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should keep ledger and alert state when the notifier fails")
    void notifierFailureIsolated() {
        notifier.failWith(true);
        collector.answer("source-1", 70, 100.0);

        ExecutionRecord record = executor().run(rate, T0);

        assertThat(record.isSuccess()).isTrue();
        assertThat(ledger.size()).isEqualTo(1);
        assertThat(alerts.get(1).isTriggered()).isTrue();
    }

    @Test
    @DisplayName("Should treat an evaluator error as no alert")
    void evaluatorFailure() {
        Evaluator broken = new Evaluator() {
            @Override
            public EvaluationResult evaluate(Indicator indicator, double currentValue, Double baselineValue) {
                throw new ArithmeticException("bad input");
            }
        };
        collector.answer("source-1", 70, 100.0);

        ExecutionRecord record = executorBuilder().evaluator(broken).build().run(rate, T0);

        assertThat(record.isSuccess()).isTrue();
        assertThat(record.getDeviationPercent()).isNull();
        assertThat(notifier.triggered).isEmpty();
    }

    @Test
    @DisplayName("Should propagate ledger failures")
    void ledgerFailurePropagates() {
        ExecutionLedger failing = new InMemoryExecutionLedger() {
            @Override
            public void append(ExecutionRecord record) {
                throw new IllegalStateException("ledger unavailable");
            }
        };
        collector.answer("source-1", 70, 100.0);

        assertThatThrownBy(() -> executorBuilder().ledger(failing).build().run(rate, T0))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("ledger unavailable");
        assertThat(alerts.get(1).getStatus()).isEqualTo(AlertStatus.NONE);
    }

    @Test
    @DisplayName("Should pass the indicator window and a deadline to the collector")
    void collectorArguments() {
        Indicator trend = TestIndicators.trend(2, 20, 720).build();
        store.save(trend);
        List<Object[]> seen = new CopyOnWriteArrayList<>();
        IndicatorExecutor executor = executorBuilder()
                .collector((sourceRef, windowMinutes, deadline) -> {
                    seen.add(new Object[] {sourceRef, windowMinutes, deadline});
                    return CollectionResult.success(100, 100.0);
                })
                .collectionTimeout(Duration.ofSeconds(30))
                .build();

        executor.run(trend, T0);

        assertThat(seen).singleElement().satisfies(args -> {
            assertThat(args[0]).isEqualTo("source-2");
            assertThat(args[1]).isEqualTo(720);
            assertThat(args[2]).isEqualTo(T0.plusSeconds(30));
        });
    }

    @Test
    @DisplayName("Should report the evaluator's severity for a threshold breach")
    void thresholdBreach() {
        Indicator errors = TestIndicators.threshold(3, 10, ComparisonOperator.GT).build();
        store.save(errors);
        collector.answer("source-3", 11, null);

        executorBuilder().evaluator(new Evaluator(Severity.HIGH)).build().run(errors, T0);

        assertThat(notifier.triggered).extracting(AlertTriggeredNotification::getSeverity)
                .containsExactly(Severity.HIGH);
        assertThat(notifier.triggered.get(0).getDeviationPercent()).isNull();
    }

    private IndicatorExecutor executor() {
        return executorBuilder().build();
    }

    private IndicatorExecutor.Builder executorBuilder() {
        return IndicatorExecutor.builder()
                .collector(collector)
                .ledger(ledger)
                .indicatorStore(store)
                .alertStore(alerts)
                .notifier(notifier)
                .metrics(new MonitorMetrics(registry))
                .collectionPool(collectionPool)
                .collectionTimeout(Duration.ofSeconds(5));
    }
}
