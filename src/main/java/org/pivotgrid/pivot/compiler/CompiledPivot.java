package org.pivotgrid.pivot.compiler;

import org.pivotgrid.pivot.api.CompiledQuery;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Everything the engine has to run for one pivot.
 *
 * @param pivot          the resolved request
 * @param mode           aggregate or raw pass-through
 * @param leafLevel      the finest grouping level; its query drives the hierarchy
 * @param queries        one query per grouping level, the leaf level included
 * @param countQuery     counts the full result when a row cap was pushed into SQL, else {@code null}
 * @param rowLimit       the row cap pushed into the leaf query, else {@code null}
 * @param resultCeiling  maximum rows any query may return before the result counts as too large
 */
public record CompiledPivot(
    ResolvedPivot pivot,
    Mode mode,
    GroupingLevel leafLevel,
    Map<GroupingLevel, CompiledQuery> queries,
    CompiledQuery countQuery,
    Integer rowLimit,
    int resultCeiling
) {

    public enum Mode { AGGREGATE, PASS_THROUGH }

    public CompiledPivot {
        queries = Collections.unmodifiableMap(new TreeMap<>(queries));
    }

    public CompiledQuery leafQuery() {
        return queries.get(leafLevel);
    }

    public boolean isRowLimitPushedDown() {
        return rowLimit != null;
    }
}
