package org.pivotgrid.pivot.api;

import java.util.List;

/**
 * Flat, ordered result of one executed query. Values are addressed by position.
 *
 * @param columns column labels as reported by the engine
 * @param rows    rows of typed values, each the same width as {@code columns}
 */
public record QueryResult(List<String> columns, List<List<PivotValue>> rows) {

    public QueryResult {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }
}
