package com.indicatorsentinel.core.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-interval driver that calls {@link IndicatorScheduler#tick()}.
 *
 * <p>
 * A failing tick is logged and the next one still fires; an exception escaping
 * a fixed-rate task would otherwise cancel all later executions.
 * </p>
 *
 * @since 1.0.0
 */
public class TickDriver implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(TickDriver.class);

    private final IndicatorScheduler scheduler;
    private final Duration interval;
    private final ScheduledExecutorService timer;

    public TickDriver(IndicatorScheduler scheduler, Duration interval) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive, got " + interval);
        }
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "indicator-tick");
            t.setDaemon(true);
            return t;
        });
    }

    /** Start ticking immediately and then every interval. */
    public void start() {
        timer.scheduleAtFixedRate(this::safeTick, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        LOG.info("Tick driver started (interval={}s)", interval.toSeconds());
    }

    void safeTick() {
        try {
            scheduler.tick();
        } catch (RuntimeException e) {
            LOG.error("Scheduler tick failed", e);
        }
    }

    /** Stop ticking; a tick already in progress finishes. */
    public void stop() {
        timer.shutdown();
        try {
            if (!timer.awaitTermination(interval.toMillis(), TimeUnit.MILLISECONDS)) {
                timer.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            timer.shutdownNow();
        }
        LOG.info("Tick driver stopped");
    }

    @Override
    public void close() {
        stop();
    }
}
