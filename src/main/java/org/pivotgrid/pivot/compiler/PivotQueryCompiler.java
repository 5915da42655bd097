package org.pivotgrid.pivot.compiler;

import org.pivotgrid.pivot.api.CompiledQuery;
import org.pivotgrid.pivot.api.DatasetSchema;
import org.pivotgrid.pivot.api.Field;
import org.pivotgrid.pivot.api.PivotConfiguration;
import org.pivotgrid.pivot.api.PivotValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Composes filter and aggregation clauses into the grouping queries a pivot needs.
 *
 * <p>A pivot is answered with plain grouped aggregations rather than an engine-specific PIVOT
 * operator: one query per {@link GroupingLevel}. The leaf level groups by all row and column
 * fields and is ordered; the coarser levels provide the aggregates shown for collapsed nodes,
 * subtotals and grand totals. Column keys are spread into column headers by the materializer.</p>
 *
 * <p>All key and measure columns are read by position, so aliases never need to be resolved.</p>
 */
public final class PivotQueryCompiler {

    private static final Logger LOGGER = LoggerFactory.getLogger(PivotQueryCompiler.class);

    /** Alias of the row count column. */
    public static final String TOTAL_ALIAS = "__total";
    /** Alias of the derived table counted by the row count query. */
    public static final String GROUPS_ALIAS = "__groups";

    private final FilterClauseCompiler filterCompiler;
    private final int maxRowsPerQuery;

    /**
     * @param filterCompiler  compiles individual filter predicates
     * @param maxRowsPerQuery ceiling on rows any single query may return
     */
    public PivotQueryCompiler(final FilterClauseCompiler filterCompiler, final int maxRowsPerQuery) {
        if (maxRowsPerQuery <= 0) {
            throw new IllegalArgumentException("maxRowsPerQuery must be positive");
        }
        this.filterCompiler = filterCompiler;
        this.maxRowsPerQuery = maxRowsPerQuery;
    }

    public CompiledPivot compile(final ResolvedPivot pivot) {
        final SqlFragment where = where(pivot);
        final CompiledPivot compiled = pivot.passThrough()
            ? compilePassThrough(pivot, where)
            : compileAggregate(pivot, where);

        if (LOGGER.isDebugEnabled()) {
            compiled.queries().forEach((level, query) ->
                LOGGER.debug("Compiled level {} for dataset '{}': {}", level, pivot.schema().dataset(), query.sql()));
            if (compiled.countQuery() != null) {
                LOGGER.debug("Compiled count query for dataset '{}': {}", pivot.schema().dataset(), compiled.countQuery().sql());
            }
        }
        return compiled;
    }

    /**
     * Compiles the lookup of distinct non-null values of one field, ascending.
     */
    public CompiledQuery compileFieldValues(final DatasetSchema schema, final Field field, final int limit) {
        final String column = SqlIdentifiers.quote(field.id());
        final String sql = "SELECT DISTINCT " + column
            + " FROM " + SqlIdentifiers.table(schema.schema(), schema.table())
            + " WHERE " + column + " IS NOT NULL"
            + " ORDER BY " + column + " ASC"
            + " LIMIT " + limit;
        return new CompiledQuery(sql, List.of());
    }

    private CompiledPivot compilePassThrough(final ResolvedPivot pivot, final SqlFragment where) {
        final PivotConfiguration config = pivot.configuration();
        final String from = " FROM " + SqlIdentifiers.table(pivot.schema().schema(), pivot.schema().table())
            + whereClause(where);
        final List<PivotValue> params = parameters(where);

        // Raw previews are always capped; without maxRows the ceiling itself is the cap.
        final int rowLimit = config.maxRows() != null ? Math.min(config.maxRows(), maxRowsPerQuery) : maxRowsPerQuery;
        final CompiledQuery leaf = new CompiledQuery("SELECT *" + from + " LIMIT " + (rowLimit + 1), params);
        final CompiledQuery count = new CompiledQuery("SELECT COUNT(*) AS " + SqlIdentifiers.quote(TOTAL_ALIAS) + from, params);

        final GroupingLevel level = new GroupingLevel(0, 0);
        return new CompiledPivot(pivot, CompiledPivot.Mode.PASS_THROUGH, level, Map.of(level, leaf), count,
            rowLimit, maxRowsPerQuery);
    }

    private CompiledPivot compileAggregate(final ResolvedPivot pivot, final SqlFragment where) {
        final PivotConfiguration config = pivot.configuration();
        final int r = pivot.rowDepth();
        final int c = pivot.columnDepth();
        final GroupingLevel leafLevel = new GroupingLevel(r, c);

        // A row cap only maps onto SQL LIMIT when every rendered row is one leaf group.
        final Integer rowLimit = (r == 1 && c == 0) ? pushableRowLimit(config) : null;

        final Map<GroupingLevel, CompiledQuery> queries = new TreeMap<>();
        for (final int rowDepth : neededDepths(r, pivot.request().expandedPaths(), config)) {
            for (final int columnDepth : neededDepths(c, pivot.request().expandedColumnPaths(), config)) {
                final GroupingLevel level = new GroupingLevel(rowDepth, columnDepth);
                final boolean leaf = level.equals(leafLevel);
                final int limit = (leaf && rowLimit != null ? rowLimit : maxRowsPerQuery) + 1;
                queries.put(level, groupingQuery(pivot, where, rowDepth, columnDepth, leaf, limit));
            }
        }

        CompiledQuery count = null;
        if (rowLimit != null) {
            final List<String> keys = keyColumns(pivot, r, 0);
            final String inner = "SELECT " + String.join(", ", keys)
                + " FROM " + SqlIdentifiers.table(pivot.schema().schema(), pivot.schema().table())
                + whereClause(where)
                + " GROUP BY " + String.join(", ", keys);
            count = new CompiledQuery(
                "SELECT COUNT(*) AS " + SqlIdentifiers.quote(TOTAL_ALIAS)
                    + " FROM (" + inner + ") AS " + SqlIdentifiers.quote(GROUPS_ALIAS),
                parameters(where));
        }

        return new CompiledPivot(pivot, CompiledPivot.Mode.AGGREGATE, leafLevel, queries, count, rowLimit,
            maxRowsPerQuery);
    }

    /**
     * Depths of one axis whose aggregates the visible hierarchy can reference: the leaf depth,
     * the top level, the children of every expanded node, the expanded nodes themselves when
     * subtotals are shown, and depth zero for grand totals.
     */
    static SortedSet<Integer> neededDepths(final int axisDepth, final Set<List<String>> expanded,
                                           final PivotConfiguration config) {
        final SortedSet<Integer> depths = new TreeSet<>();
        depths.add(axisDepth);
        if (axisDepth == 0) {
            return depths;
        }
        depths.add(1);
        for (final List<String> path : expanded) {
            final int length = path.size();
            if (length == 0 || length >= axisDepth) {
                continue;
            }
            depths.add(length + 1);
            if (config.showSubtotals()) {
                depths.add(length);
            }
        }
        if (config.showGrandTotals()) {
            depths.add(0);
        }
        return depths;
    }

    private CompiledQuery groupingQuery(final ResolvedPivot pivot, final SqlFragment where,
                                        final int rowDepth, final int columnDepth,
                                        final boolean ordered, final int limit) {
        final List<String> keys = keyColumns(pivot, rowDepth, columnDepth);
        final List<String> select = new ArrayList<>(keys);
        for (final Measure measure : pivot.measures()) {
            select.add(measure.expression() + " AS " + SqlIdentifiers.quote(measure.label()));
        }

        final StringBuilder sql = new StringBuilder("SELECT ")
            .append(String.join(", ", select))
            .append(" FROM ").append(SqlIdentifiers.table(pivot.schema().schema(), pivot.schema().table()))
            .append(whereClause(where));
        if (!keys.isEmpty()) {
            sql.append(" GROUP BY ").append(String.join(", ", keys));
            if (ordered) {
                final List<String> order = new ArrayList<>(keys.size());
                for (int i = 1; i <= keys.size(); i++) {
                    order.add(i + " ASC NULLS LAST");
                }
                sql.append(" ORDER BY ").append(String.join(", ", order));
            }
        }
        sql.append(" LIMIT ").append(limit);
        return new CompiledQuery(sql.toString(), parameters(where));
    }

    private static List<String> keyColumns(final ResolvedPivot pivot, final int rowDepth, final int columnDepth) {
        final List<String> keys = new ArrayList<>(rowDepth + columnDepth);
        pivot.rows().subList(0, rowDepth).forEach(f -> keys.add(SqlIdentifiers.quote(f.id())));
        pivot.columns().subList(0, columnDepth).forEach(f -> keys.add(SqlIdentifiers.quote(f.id())));
        return keys;
    }

    private Integer pushableRowLimit(final PivotConfiguration config) {
        final Integer maxRows = config.maxRows();
        return maxRows != null && maxRows <= maxRowsPerQuery ? maxRows : null;
    }

    private SqlFragment where(final ResolvedPivot pivot) {
        final List<SqlFragment> predicates = new ArrayList<>(pivot.filters().size());
        for (final ResolvedFilter filter : pivot.filters()) {
            predicates.add(filterCompiler.compile(filter));
        }
        return SqlFragment.and(predicates);
    }

    private static String whereClause(final SqlFragment where) {
        return where == null ? "" : " WHERE " + where.sql();
    }

    private static List<PivotValue> parameters(final SqlFragment where) {
        return where == null ? List.of() : where.parameters();
    }
}
