package com.indicatorsentinel.service;

import com.indicatorsentinel.core.alert.AlertStateStore;
import com.indicatorsentinel.core.alert.InMemoryAlertStateStore;
import com.indicatorsentinel.core.collector.MetricCollector;
import com.indicatorsentinel.core.config.IndicatorsLoader;
import com.indicatorsentinel.core.evaluation.Evaluator;
import com.indicatorsentinel.core.execution.IndicatorExecutor;
import com.indicatorsentinel.core.ledger.ExecutionLedger;
import com.indicatorsentinel.core.ledger.InMemoryExecutionLedger;
import com.indicatorsentinel.core.metrics.MonitorMetrics;
import com.indicatorsentinel.core.model.Indicator;
import com.indicatorsentinel.core.query.MonitorQueryService;
import com.indicatorsentinel.core.schedule.IndicatorScheduler;
import com.indicatorsentinel.core.schedule.LeaseRegistry;
import com.indicatorsentinel.core.schedule.TickDriver;
import com.indicatorsentinel.core.store.InMemoryIndicatorStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main entry point for the Indicator Sentinel service.
 *
 * <h3>Wiring</h3>
 *
 * <pre>
 *   TickDriver (every TICK_INTERVAL_SECONDS)
 *     → IndicatorScheduler (due indicators, leases, worker pool)
 *     → IndicatorExecutor (MetricCollector → Evaluator → ledger → alert state)
 *     → KafkaAlertNotifier (indicator-alerts topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * All configuration is resolved from environment variables via
 * {@link ServiceConfig}. The {@link MetricCollector} implementation is found
 * with {@link ServiceLoader}; exactly one must be on the class path.
 * </p>
 *
 * @since 1.0.0
 */
public final class IndicatorSentinelService {

    private static final Logger LOG = LoggerFactory.getLogger(IndicatorSentinelService.class);

    private IndicatorSentinelService() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting Indicator Sentinel with config: {}", config);

        // 2. Load indicator definitions
        List<Indicator> indicators = loadIndicators(config);
        if (indicators.isEmpty()) {
            throw new IllegalStateException(
                    "No indicators defined. Provide indicators via "
                            + IndicatorsLoader.ENV_INDICATORS_PATH
                            + " or a classpath indicators.yml file.");
        }
        LOG.info("Loaded {} indicator(s)", indicators.size());

        // 3. Discover the metric collector
        MetricCollector collector = discoverCollector(ServiceLoader.load(MetricCollector.class));

        // 4. Wire the engine
        Clock clock = Clock.systemUTC();
        InMemoryIndicatorStore indicatorStore = new InMemoryIndicatorStore(indicators);
        ExecutionLedger ledger = new InMemoryExecutionLedger();
        AlertStateStore alertStore = new InMemoryAlertStateStore();
        LeaseRegistry leases = new LeaseRegistry(config.leaseTtl());
        MonitorMetrics metrics = new MonitorMetrics(new SimpleMeterRegistry());
        KafkaAlertNotifier notifier = KafkaAlertNotifier.create(config);

        ExecutorService collectionPool = collectionPool(config.getWorkerPoolSize());
        ExecutorService workers = Executors.newFixedThreadPool(
                config.getWorkerPoolSize(), daemonThreads("indicator-worker"));

        IndicatorExecutor executor = IndicatorExecutor.builder()
                .collector(collector)
                .evaluator(new Evaluator(config.getThresholdSeverity()))
                .ledger(ledger)
                .indicatorStore(indicatorStore)
                .alertStore(alertStore)
                .notifier(notifier)
                .metrics(metrics)
                .collectionPool(collectionPool)
                .collectionTimeout(config.getCollectionTimeout())
                .build();
        IndicatorScheduler scheduler = new IndicatorScheduler(indicatorStore, leases, executor,
                workers, config.getWorkerPoolSize(), metrics, clock);
        MonitorQueryService queries = new MonitorQueryService(indicatorStore, ledger, alertStore, leases, clock);

        // 5. Start health server (for K8s probes)
        HealthServer healthServer = new HealthServer(() -> queries.dashboard(config.getDashboardWindow()));
        healthServer.start(config.getHealthPort());

        // 6. Start ticking
        TickDriver driver = new TickDriver(scheduler, config.getTickInterval());
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down Indicator Sentinel");
            driver.stop();
            shutdownPool(workers, config);
            collectionPool.shutdownNow();
            notifier.close();
            healthServer.stop();
            stopped.countDown();
        }, "sentinel-shutdown"));
        driver.start();

        stopped.await();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /**
     * Pick the single {@link MetricCollector} offered by the class path.
     *
     * @throws IllegalStateException if none or more than one is available
     */
    static MetricCollector discoverCollector(Iterable<MetricCollector> candidates) {
        List<MetricCollector> found = new ArrayList<>();
        candidates.forEach(found::add);
        if (found.isEmpty()) {
            throw new IllegalStateException("No MetricCollector implementation found. Register one in "
                    + "META-INF/services/" + MetricCollector.class.getName());
        }
        if (found.size() > 1) {
            throw new IllegalStateException("Expected exactly one MetricCollector, found " + found.size() + ": "
                    + found.stream().map(c -> c.getClass().getName()).toList());
        }
        MetricCollector collector = found.get(0);
        LOG.info("Using metric collector {}", collector.getClass().getName());
        return collector;
    }

    /**
     * Bounded pool for collector calls. A collector that ignores interruption
     * keeps its thread; once every thread and queue slot is taken, further
     * collections are rejected and recorded as failed runs.
     */
    static ThreadPoolExecutor collectionPool(int size) {
        return new ThreadPoolExecutor(size, size, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(size), daemonThreads("indicator-collect"),
                new ThreadPoolExecutor.AbortPolicy());
    }

    private static List<Indicator> loadIndicators(ServiceConfig config) {
        String path = config.getIndicatorsConfigPath();
        if (path != null && !path.isBlank()) {
            return IndicatorsLoader.fromFile(path);
        }
        return IndicatorsLoader.load();
    }

    private static void shutdownPool(ExecutorService pool, ServiceConfig config) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(config.getCollectionTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Indicator runs still in flight at shutdown; interrupting");
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
