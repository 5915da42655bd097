package org.pivotgrid.pivot.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.zaxxer.hikari.HikariDataSource;
import org.pivotgrid.pivot.api.PivotJson;
import org.pivotgrid.pivot.cache.PivotCacheSweeper;
import org.pivotgrid.pivot.cache.PivotResultCache;
import org.pivotgrid.pivot.engine.DataSources;
import org.pivotgrid.pivot.engine.JdbcFieldCatalog;
import org.pivotgrid.pivot.engine.JdbcQueryEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires a {@link PivotService} against a pooled JDBC engine and owns everything that has a
 * lifecycle: the connection pool, the compute pool and the cache sweeper.
 *
 * <h3>Configuration:</h3>
 * <pre>
 * database { jdbcUrl, username, password, maxPoolSize, minIdle, schema }
 * cache { ttlMinutes = 30, maxEntries = 100, sweepIntervalSeconds = 300 }
 * limits { maxRowsPerQuery = 100000, maxColumnsPerQuery = 1000, queryTimeoutSeconds = 30 }
 * computeThreads = 4
 * </pre>
 */
public final class PivotEngine implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(PivotEngine.class);

    private final HikariDataSource dataSource;
    private final PivotResultCache cache;
    private final PivotCacheSweeper sweeper;
    private final PivotService service;

    private PivotEngine(final HikariDataSource dataSource, final PivotResultCache cache,
                        final PivotCacheSweeper sweeper, final PivotService service) {
        this.dataSource = dataSource;
        this.cache = cache;
        this.sweeper = sweeper;
        this.service = service;
    }

    /**
     * Builds the engine from its options block. Nothing runs in the background until
     * {@link #start()}.
     *
     * @param name    name used for the connection pool and the compute threads
     * @param options the engine options
     */
    public static PivotEngine create(final String name, final Config options) {
        final Config cacheConfig = options.hasPath("cache") ? options.getConfig("cache") : ConfigFactory.empty();
        final Config limitsConfig = options.hasPath("limits") ? options.getConfig("limits") : ConfigFactory.empty();
        final Config database = options.getConfig("database");

        final PivotLimits limits = PivotLimits.fromConfig(limitsConfig);
        final PivotResultCache cache = new PivotResultCache(
            Duration.ofMinutes(cacheConfig.hasPath("ttlMinutes") ? cacheConfig.getInt("ttlMinutes") : 30),
            cacheConfig.hasPath("maxEntries") ? cacheConfig.getInt("maxEntries") : 100);
        final PivotCacheSweeper sweeper = new PivotCacheSweeper(cache, Duration.ofSeconds(
            cacheConfig.hasPath("sweepIntervalSeconds") ? cacheConfig.getInt("sweepIntervalSeconds") : 300));
        final int computeThreads = options.hasPath("computeThreads")
            ? options.getInt("computeThreads")
            : Math.max(2, Runtime.getRuntime().availableProcessors());

        final HikariDataSource dataSource = DataSources.create(name + "-pool", database);
        final String schema = database.hasPath("schema") ? database.getString("schema") : null;
        final ObjectMapper objectMapper = PivotJson.newObjectMapper();
        final PivotService service = new PivotService(
            new JdbcFieldCatalog(dataSource, schema),
            new JdbcQueryEngine(dataSource, (int) limits.queryTimeout().toSeconds()),
            cache,
            limits,
            newComputePool(name, computeThreads),
            objectMapper);

        LOGGER.debug("Pivot engine '{}' configured: {} compute threads, cache ttl {}, max {} entries",
            name, computeThreads, cache.getTtl(), cache.getMaxEntries());
        return new PivotEngine(dataSource, cache, sweeper, service);
    }

    public void start() {
        sweeper.start();
    }

    public PivotService getService() {
        return service;
    }

    public PivotResultCache getCache() {
        return cache;
    }

    public boolean isSweeperRunning() {
        return sweeper.isRunning();
    }

    @Override
    public void close() {
        sweeper.stop();
        service.shutdown();
        cache.clear();
        dataSource.close();
    }

    private static ExecutorService newComputePool(final String name, final int threads) {
        final AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            final Thread t = new Thread(r, name + "-compute-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
