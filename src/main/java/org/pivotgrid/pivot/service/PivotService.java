package org.pivotgrid.pivot.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.pivotgrid.pivot.api.CompiledQuery;
import org.pivotgrid.pivot.api.DatasetSchema;
import org.pivotgrid.pivot.api.DrillRequest;
import org.pivotgrid.pivot.api.Field;
import org.pivotgrid.pivot.api.IFieldCatalog;
import org.pivotgrid.pivot.api.IQueryEngine;
import org.pivotgrid.pivot.api.PivotException;
import org.pivotgrid.pivot.api.PivotMetadata;
import org.pivotgrid.pivot.api.PivotRequest;
import org.pivotgrid.pivot.api.PivotResponse;
import org.pivotgrid.pivot.api.PivotValue;
import org.pivotgrid.pivot.api.QueryResult;
import org.pivotgrid.pivot.cache.CacheEntry;
import org.pivotgrid.pivot.cache.Fingerprinter;
import org.pivotgrid.pivot.cache.PivotResultCache;
import org.pivotgrid.pivot.compiler.AggregationClauseCompiler;
import org.pivotgrid.pivot.compiler.CompiledPivot;
import org.pivotgrid.pivot.compiler.FilterClauseCompiler;
import org.pivotgrid.pivot.compiler.GroupingLevel;
import org.pivotgrid.pivot.compiler.PivotQueryCompiler;
import org.pivotgrid.pivot.compiler.RequestValidator;
import org.pivotgrid.pivot.compiler.ResolvedPivot;
import org.pivotgrid.pivot.materializer.HierarchicalMaterializer;
import org.pivotgrid.pivot.materializer.MaterializedPivot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point of the pivot pipeline: validate, fingerprint, consult the cache, compile, execute,
 * materialize and cache.
 *
 * <p>Engine work runs on a dedicated compute pool so that callers are never serialized behind
 * one query. Concurrent requests with the same fingerprint share a single computation; the
 * caller waits at most {@link PivotLimits#queryTimeout()}, after which it gets
 * {@code QueryExecutionFailed} while the shared computation still runs to completion and fills
 * the cache.</p>
 *
 * <p>Thread Safety: This class is thread-safe.</p>
 */
public class PivotService {

    private static final Logger LOGGER = LoggerFactory.getLogger(PivotService.class);

    /** Default number of values returned by {@link #listFieldValues(String, String, Integer)}. */
    public static final int DEFAULT_VALUE_LIMIT = 100;

    private final IFieldCatalog catalog;
    private final IQueryEngine engine;
    private final PivotResultCache cache;
    private final PivotLimits limits;
    private final ExecutorService computeExecutor;
    private final Clock clock;

    private final RequestValidator validator = new RequestValidator(new AggregationClauseCompiler());
    private final PivotQueryCompiler compiler;
    private final HierarchicalMaterializer materializer = new HierarchicalMaterializer();
    private final Fingerprinter fingerprinter;
    private final ConcurrentHashMap<String, CompletableFuture<CacheEntry>> inFlight = new ConcurrentHashMap<>();

    public PivotService(final IFieldCatalog catalog, final IQueryEngine engine, final PivotResultCache cache,
                        final PivotLimits limits, final ExecutorService computeExecutor, final ObjectMapper objectMapper) {
        this(catalog, engine, cache, limits, computeExecutor, objectMapper, Clock.systemUTC());
    }

    public PivotService(final IFieldCatalog catalog, final IQueryEngine engine, final PivotResultCache cache,
                        final PivotLimits limits, final ExecutorService computeExecutor, final ObjectMapper objectMapper,
                        final Clock clock) {
        this.catalog = catalog;
        this.engine = engine;
        this.cache = cache;
        this.limits = limits;
        this.computeExecutor = computeExecutor;
        this.clock = clock;
        this.compiler = new PivotQueryCompiler(new FilterClauseCompiler(), limits.maxRowsPerQuery());
        this.fingerprinter = new Fingerprinter(objectMapper);
    }

    /**
     * Computes a pivot, answering from the cache when possible.
     *
     * @throws PivotException on validation, compilation or execution failure
     */
    public PivotResponse computePivot(final PivotRequest request) {
        final DatasetSchema schema = catalog.describe(request.dataset());
        final ResolvedPivot resolved = validator.resolve(request, schema);
        final String fingerprint = fingerprinter.fingerprint(request);

        final Optional<CacheEntry> hit = cache.get(fingerprint);
        if (hit.isPresent()) {
            LOGGER.debug("Cache hit for pivot {}", fingerprint);
            return toResponse(hit.get(), true);
        }
        return toResponse(awaitComputation(fingerprint, resolved), false);
    }

    /**
     * Expands or collapses one node of a cached pivot and computes the resulting pivot.
     *
     * @throws PivotException {@code CacheKeyNotFound} if the source pivot is absent or expired
     */
    public PivotResponse drill(final DrillRequest drill) {
        final CacheEntry source = cache.get(drill.fingerprint())
            .orElseThrow(() -> PivotException.cacheKeyNotFound(drill.fingerprint()));
        final PivotRequest next = DrillCoordinator.derive(source.request(), drill);
        LOGGER.debug("{} {} path {} of pivot {}", drill.action().wireName(), drill.axis().wireName(),
            drill.path(), drill.fingerprint());
        return computePivot(next);
    }

    public List<Field> listFields(final String dataset) {
        return catalog.describe(dataset).fields();
    }

    /**
     * Lists distinct non-null values of a field in ascending order.
     *
     * @param limit maximum number of values, {@code null} for {@link #DEFAULT_VALUE_LIMIT}
     * @throws IllegalArgumentException if {@code limit} is outside {@code [1, maxRowsPerQuery]}
     */
    public List<PivotValue> listFieldValues(final String dataset, final String fieldId, final Integer limit) {
        final int effectiveLimit = limit != null ? limit : DEFAULT_VALUE_LIMIT;
        if (effectiveLimit < 1 || effectiveLimit > limits.maxRowsPerQuery()) {
            throw new IllegalArgumentException(
                "limit must be between 1 and " + limits.maxRowsPerQuery() + ", got " + effectiveLimit);
        }
        final DatasetSchema schema = catalog.describe(dataset);
        final Field field = schema.field(fieldId).orElseThrow(() -> PivotException.unknownField(dataset, fieldId));
        final QueryResult result = engine.execute(compiler.compileFieldValues(schema, field, effectiveLimit));
        final List<PivotValue> values = new ArrayList<>(result.size());
        result.rows().forEach(row -> values.add(row.get(0)));
        return values;
    }

    public int cacheSize() {
        return cache.size();
    }

    /**
     * Stops the compute pool. Running computations get one timeout period to finish.
     */
    public void shutdown() {
        computeExecutor.shutdown();
        try {
            if (!computeExecutor.awaitTermination(limits.queryTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                computeExecutor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            computeExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private CacheEntry awaitComputation(final String fingerprint, final ResolvedPivot resolved) {
        final CompletableFuture<CacheEntry> created = new CompletableFuture<>();
        final CompletableFuture<CacheEntry> existing = inFlight.putIfAbsent(fingerprint, created);
        final CompletableFuture<CacheEntry> future;
        if (existing != null) {
            LOGGER.debug("Joining in-flight computation of pivot {}", fingerprint);
            future = existing;
        } else {
            future = created;
            // a computation may have completed between the cache miss and the registration
            final Optional<CacheEntry> late = cache.get(fingerprint);
            if (late.isPresent()) {
                created.complete(late.get());
                inFlight.remove(fingerprint, created);
            } else {
                try {
                    computeExecutor.execute(() -> compute(fingerprint, resolved, created));
                } catch (final RejectedExecutionException e) {
                    inFlight.remove(fingerprint, created);
                    throw PivotException.executionFailed("Pivot engine is shutting down", e);
                }
            }
        }

        try {
            return future.get(limits.queryTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (final TimeoutException e) {
            throw PivotException.executionFailed(
                "Pivot computation exceeded " + limits.queryTimeout().toSeconds() + "s", e);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw PivotException.executionFailed("Interrupted while waiting for pivot computation", e);
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof PivotException) {
                final PivotException pivotException = (PivotException) cause;
                throw new PivotException(pivotException.getKind(), pivotException.getMessage(), pivotException);
            }
            throw PivotException.executionFailed("Pivot computation failed: " + cause.getMessage(), cause);
        }
    }

    private void compute(final String fingerprint, final ResolvedPivot resolved,
                         final CompletableFuture<CacheEntry> future) {
        try {
            final CacheEntry entry = run(fingerprint, resolved);
            cache.put(entry);
            future.complete(entry);
        } catch (final Throwable t) {
            future.completeExceptionally(t);
        } finally {
            inFlight.remove(fingerprint, future);
        }
    }

    private CacheEntry run(final String fingerprint, final ResolvedPivot resolved) {
        final long start = System.nanoTime();
        final CompiledPivot compiled = compiler.compile(resolved);

        final Map<GroupingLevel, QueryResult> results = new HashMap<>();
        for (final Map.Entry<GroupingLevel, CompiledQuery> query : compiled.queries().entrySet()) {
            final QueryResult result = engine.execute(query.getValue());
            final boolean cappedLeaf = compiled.isRowLimitPushedDown() && query.getKey().equals(compiled.leafLevel());
            if (!cappedLeaf && result.size() > compiled.resultCeiling()) {
                throw PivotException.resultTooLarge(String.format(
                    "Grouping level %s returned more than %d rows; add filters or set maxRows",
                    query.getKey(), compiled.resultCeiling()));
            }
            results.put(query.getKey(), result);
        }

        Long fullRowCount = null;
        if (compiled.countQuery() != null && compiled.isRowLimitPushedDown()
            && results.get(compiled.leafLevel()).size() > compiled.rowLimit()) {
            final QueryResult count = engine.execute(compiled.countQuery());
            fullRowCount = count.rows().get(0).get(0).asNumber().longValue();
        }

        final MaterializedPivot materialized = materializer.materialize(compiled, results, fullRowCount);
        if (materialized.structure().columnCount() > limits.maxColumnsPerQuery()) {
            throw PivotException.resultTooLarge(String.format(
                "Pivot renders %d columns, more than the allowed %d; set maxColumns",
                materialized.structure().columnCount(), limits.maxColumnsPerQuery()));
        }

        final long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        LOGGER.debug("Computed pivot {} on dataset '{}': {} rows x {} columns in {} ms",
            fingerprint, resolved.schema().dataset(), materialized.structure().rowCount(),
            materialized.structure().columnCount(), elapsedMs);
        return new CacheEntry(fingerprint, materialized.structure(), resolved.request(), clock.instant(),
            materialized.hasMore(), materialized.totalDataRows(), elapsedMs);
    }

    private static PivotResponse toResponse(final CacheEntry entry, final boolean cached) {
        final PivotMetadata metadata = new PivotMetadata(
            entry.totalDataRows(),
            entry.computationTimeMs(),
            entry.fingerprint(),
            entry.createdAt().toEpochMilli(),
            cached,
            entry.request().expandedPaths(),
            entry.request().expandedColumnPaths());
        return PivotResponse.success(entry.structure(), metadata, entry.hasMore());
    }
}
