package org.pivotgrid.pivot.api;

import java.util.List;

/**
 * The materialized table. {@code rowCount}/{@code columnCount} describe the rendered matrix,
 * {@code totalRows}/{@code totalColumns} the size before any truncation.
 */
public record PivotStructure(
    List<List<PivotCell>> matrix,
    List<List<HeaderNode>> rowHeaders,
    List<List<HeaderNode>> columnHeaders,
    int rowCount,
    int columnCount,
    long totalRows,
    long totalColumns
) {
}
