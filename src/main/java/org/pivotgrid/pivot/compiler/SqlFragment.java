package org.pivotgrid.pivot.compiler;

import org.pivotgrid.pivot.api.PivotValue;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A piece of SQL text together with the parameters its placeholders bind to.
 */
public record SqlFragment(String sql, List<PivotValue> parameters) {

    public SqlFragment {
        parameters = List.copyOf(parameters);
    }

    public static SqlFragment of(final String sql, final PivotValue... parameters) {
        return new SqlFragment(sql, List.of(parameters));
    }

    /**
     * AND-joins fragments. Returns {@code null} for an empty list.
     */
    public static SqlFragment and(final List<SqlFragment> fragments) {
        if (fragments.isEmpty()) {
            return null;
        }
        final List<PivotValue> params = new ArrayList<>();
        fragments.forEach(f -> params.addAll(f.parameters()));
        final String sql = fragments.stream().map(SqlFragment::sql).collect(Collectors.joining(" AND "));
        return new SqlFragment(sql, params);
    }
}
