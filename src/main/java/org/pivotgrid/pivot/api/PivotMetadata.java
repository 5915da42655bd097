package org.pivotgrid.pivot.api;

import java.util.List;
import java.util.Set;

public record PivotMetadata(
    long totalDataRows,
    long computationTimeMs,
    String fingerprint,
    long timestamp,
    boolean cached,
    Set<List<String>> expandedPaths,
    Set<List<String>> expandedColumnPaths
) {
}
