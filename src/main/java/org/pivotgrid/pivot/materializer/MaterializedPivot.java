package org.pivotgrid.pivot.materializer;

import org.pivotgrid.pivot.api.PivotStructure;

/**
 * Output of a materialization.
 *
 * @param structure     the rendered table
 * @param hasMore       whether rows or columns were truncated
 * @param totalDataRows number of leaf groups (aggregate) or raw rows (pass-through) in the full result
 */
public record MaterializedPivot(PivotStructure structure, boolean hasMore, long totalDataRows) {
}
