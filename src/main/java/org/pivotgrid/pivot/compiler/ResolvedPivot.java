package org.pivotgrid.pivot.compiler;

import org.pivotgrid.pivot.api.DatasetSchema;
import org.pivotgrid.pivot.api.Field;
import org.pivotgrid.pivot.api.PivotConfiguration;
import org.pivotgrid.pivot.api.PivotRequest;

import java.util.List;

/**
 * A validated request with every field bound to its catalog definition.
 *
 * @param request     the request as submitted
 * @param schema      the dataset description
 * @param rows        row grouping fields
 * @param columns     column grouping fields
 * @param measures    compiled measures, empty for a pass-through projection
 * @param filters     enabled filters with coerced arguments
 * @param passThrough whether the pivot is an unaggregated raw preview
 */
public record ResolvedPivot(
    PivotRequest request,
    DatasetSchema schema,
    List<Field> rows,
    List<Field> columns,
    List<Measure> measures,
    List<ResolvedFilter> filters,
    boolean passThrough
) {

    public ResolvedPivot {
        rows = List.copyOf(rows);
        columns = List.copyOf(columns);
        measures = List.copyOf(measures);
        filters = List.copyOf(filters);
    }

    public PivotConfiguration configuration() {
        return request.configuration();
    }

    public int rowDepth() {
        return rows.size();
    }

    public int columnDepth() {
        return columns.size();
    }

    public boolean isRowExpanded(final List<String> path) {
        return request.expandedPaths().contains(path);
    }

    public boolean isColumnExpanded(final List<String> path) {
        return request.expandedColumnPaths().contains(path);
    }
}
