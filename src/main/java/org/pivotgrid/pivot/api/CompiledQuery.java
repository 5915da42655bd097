package org.pivotgrid.pivot.api;

import java.util.List;

/**
 * A parameterized SQL statement. Every literal travels in {@code parameters}, bound in order
 * to the {@code ?} placeholders of {@code sql}.
 */
public record CompiledQuery(String sql, List<PivotValue> parameters) {

    public CompiledQuery {
        parameters = List.copyOf(parameters);
    }
}
