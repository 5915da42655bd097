package org.pivotgrid.pivot.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically sweeps expired entries out of a {@link PivotResultCache} on a daemon thread.
 * Sweeping starts with {@link #start()} and ends with {@link #stop()}.
 */
public class PivotCacheSweeper {

    private static final Logger LOGGER = LoggerFactory.getLogger(PivotCacheSweeper.class);

    private final PivotResultCache cache;
    private final Duration interval;
    private ScheduledExecutorService executor;

    public PivotCacheSweeper(final PivotResultCache cache, final Duration interval) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Sweep interval must be positive, got " + interval);
        }
        this.cache = cache;
        this.interval = interval;
    }

    public synchronized void start() {
        if (executor != null) {
            LOGGER.warn("Cache sweeper is already running.");
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "pivot-cache-sweeper");
            t.setDaemon(true);
            return t;
        });
        final long millis = interval.toMillis();
        executor.scheduleAtFixedRate(this::sweepOnce, millis, millis, TimeUnit.MILLISECONDS);
        LOGGER.debug("Started cache sweeper with {} ms interval", millis);
    }

    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor = null;
        LOGGER.debug("Stopped cache sweeper");
    }

    public synchronized boolean isRunning() {
        return executor != null;
    }

    private void sweepOnce() {
        try {
            cache.sweep();
        } catch (final RuntimeException e) {
            // an exception would cancel all future runs
            LOGGER.error("Cache sweep failed", e);
        }
    }
}
