package com.indicatorsentinel.core.schedule;

import com.indicatorsentinel.core.alert.InMemoryAlertStateStore;
import com.indicatorsentinel.core.execution.IndicatorExecutor;
import com.indicatorsentinel.core.ledger.InMemoryExecutionLedger;
import com.indicatorsentinel.core.metrics.MonitorMetrics;
import com.indicatorsentinel.core.model.Indicator;
import com.indicatorsentinel.core.store.InMemoryIndicatorStore;
import com.indicatorsentinel.core.support.RecordingNotifier;
import com.indicatorsentinel.core.support.ScriptedCollector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * Unit tests for {@link TickDriver}.
 */
class TickDriverTest {

    @Test
    @DisplayName("Should keep ticking after a tick fails")
    void survivesFailingTick() throws InterruptedException {
        CountDownLatch ticks = new CountDownLatch(3);
        AtomicInteger calls = new AtomicInteger();
        InMemoryIndicatorStore store = new InMemoryIndicatorStore() {
            @Override
            public List<Indicator> findAll() {
                ticks.countDown();
                if (calls.incrementAndGet() == 1) {
                    throw new IllegalStateException("indicator store unavailable");
                }
                return super.findAll();
            }
        };
        ExecutorService pool = Executors.newCachedThreadPool();
        TickDriver driver = new TickDriver(scheduler(store, pool), Duration.ofMillis(20));
        try {
            driver.start();

            assertThat(ticks.await(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            driver.close();
            pool.shutdownNow();
        }
        assertThat(calls.get()).isGreaterThanOrEqualTo(3);
    }

    @Test
    @DisplayName("Should swallow and log a failing tick when called directly")
    void safeTickDoesNotThrow() {
        InMemoryIndicatorStore store = new InMemoryIndicatorStore() {
            @Override
            public List<Indicator> findAll() {
                throw new IllegalStateException("indicator store unavailable");
            }
        };
        ExecutorService pool = Executors.newCachedThreadPool();
        try {
            TickDriver driver = new TickDriver(scheduler(store, pool), Duration.ofSeconds(1));

            assertThatCode(driver::safeTick).doesNotThrowAnyException();
        } finally {
            pool.shutdownNow();
        }
    }

    private static IndicatorScheduler scheduler(InMemoryIndicatorStore store, ExecutorService pool) {
        MonitorMetrics metrics = new MonitorMetrics(new SimpleMeterRegistry());
        IndicatorExecutor executor = IndicatorExecutor.builder()
                .collector(new ScriptedCollector())
                .ledger(new InMemoryExecutionLedger())
                .indicatorStore(store)
                .alertStore(new InMemoryAlertStateStore())
                .notifier(new RecordingNotifier())
                .metrics(metrics)
                .collectionPool(pool)
                .build();
        return new IndicatorScheduler(store, new LeaseRegistry(Duration.ofMinutes(1)), executor, pool, 2,
                metrics, Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC));
    }
}
