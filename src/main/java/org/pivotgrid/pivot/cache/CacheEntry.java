package org.pivotgrid.pivot.cache;

import org.pivotgrid.pivot.api.PivotRequest;
import org.pivotgrid.pivot.api.PivotStructure;

import java.time.Instant;

/**
 * A materialized pivot held by the {@link PivotResultCache}, together with the request that
 * produced it so drills can derive follow-up requests.
 */
public record CacheEntry(
    String fingerprint,
    PivotStructure structure,
    PivotRequest request,
    Instant createdAt,
    boolean hasMore,
    long totalDataRows,
    long computationTimeMs
) {
}
