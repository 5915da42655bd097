package org.pivotgrid.pivot.compiler;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pivotgrid.pivot.api.CompiledQuery;
import org.pivotgrid.pivot.api.FilterOperator;
import org.pivotgrid.pivot.api.PivotConfiguration;
import org.pivotgrid.pivot.api.PivotRequest;
import org.pivotgrid.pivot.api.PivotValue;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pivotgrid.pivot.PivotFixtures.PRODUCT;
import static org.pivotgrid.pivot.PivotFixtures.QUARTER;
import static org.pivotgrid.pivot.PivotFixtures.REGION;
import static org.pivotgrid.pivot.PivotFixtures.REVENUE;
import static org.pivotgrid.pivot.PivotFixtures.SALES;
import static org.pivotgrid.pivot.PivotFixtures.config;
import static org.pivotgrid.pivot.PivotFixtures.filter;
import static org.pivotgrid.pivot.PivotFixtures.sum;

@Tag("unit")
class PivotQueryCompilerTest {

    private final RequestValidator validator = new RequestValidator(new AggregationClauseCompiler());
    private final PivotQueryCompiler compiler = new PivotQueryCompiler(new FilterClauseCompiler(), 1000);

    private CompiledPivot compile(final PivotRequest request) {
        return compiler.compile(validator.resolve(request, SALES));
    }

    @Test
    void leafQueryGroupsByRowsThenColumnsAndOrders() {
        final CompiledPivot compiled = compile(new PivotRequest("sales",
            config(List.of(REGION), List.of(QUARTER), List.of(sum(REVENUE)))));

        assertThat(compiled.mode()).isEqualTo(CompiledPivot.Mode.AGGREGATE);
        assertThat(compiled.leafLevel()).isEqualTo(new GroupingLevel(1, 1));
        assertThat(compiled.leafQuery().sql()).isEqualTo(
            "SELECT \"region\", \"quarter\", SUM(\"revenue\") AS \"Revenue\" FROM \"sales\""
                + " GROUP BY \"region\", \"quarter\" ORDER BY 1 ASC NULLS LAST, 2 ASC NULLS LAST LIMIT 1001");
        assertThat(compiled.countQuery()).isNull();
        assertThat(compiled.isRowLimitPushedDown()).isFalse();
    }

    @Test
    void grandTotalsAddRollupLevels() {
        final CompiledPivot compiled = compile(new PivotRequest("sales",
            config(List.of(REGION), List.of(QUARTER), List.of(sum(REVENUE)), false, true)));

        assertThat(compiled.queries().keySet()).containsExactly(
            new GroupingLevel(0, 0), new GroupingLevel(0, 1), new GroupingLevel(1, 0), new GroupingLevel(1, 1));
        assertThat(compiled.queries().get(new GroupingLevel(0, 0)).sql())
            .isEqualTo("SELECT SUM(\"revenue\") AS \"Revenue\" FROM \"sales\" LIMIT 1001");
        // roll-ups are unordered
        assertThat(compiled.queries().get(new GroupingLevel(1, 0)).sql()).doesNotContain("ORDER BY");
    }

    @Test
    void collapsedHierarchyOnlyQueriesTopLevelAndLeaf() {
        final CompiledPivot compiled = compile(new PivotRequest("sales",
            config(List.of(REGION, PRODUCT, QUARTER), List.of(), List.of(sum(REVENUE)))));

        assertThat(compiled.queries().keySet())
            .containsExactly(new GroupingLevel(1, 0), new GroupingLevel(3, 0));
    }

    @Test
    void expandedPathsAddChildLevelsAndSubtotalsAddTheirOwn() {
        final PivotRequest request = new PivotRequest("sales",
            config(List.of(REGION, PRODUCT, QUARTER), List.of(), List.of(sum(REVENUE)), true, false),
            Set.of(List.of("US", "Widget")), Set.of());

        assertThat(compile(request).queries().keySet())
            .containsExactly(new GroupingLevel(1, 0), new GroupingLevel(2, 0), new GroupingLevel(3, 0));
    }

    @Test
    void filtersBecomeParameterizedWhereClauseSharedByAllLevels() {
        final PivotConfiguration config = new PivotConfiguration(List.of(REGION), List.of(QUARTER), List.of(sum(REVENUE)),
            List.of(filter(REGION, FilterOperator.IN, "[\"US\",\"EU\"]"), filter(REVENUE, FilterOperator.GREATER_THAN, "10")),
            false, true, null, null);

        final CompiledPivot compiled = compile(new PivotRequest("sales", config));

        for (final CompiledQuery query : compiled.queries().values()) {
            assertThat(query.sql()).contains(" WHERE (\"region\" IN (?, ?)) AND (\"revenue\" > ?)");
            assertThat(query.parameters()).containsExactly(
                PivotValue.ofString("US"), PivotValue.ofString("EU"), PivotValue.ofNumber(10));
        }
    }

    @Test
    void flatRowLimitIsPushedIntoSqlWithCountQuery() {
        final PivotConfiguration config = new PivotConfiguration(List.of(REGION), List.of(), List.of(sum(REVENUE)),
            List.of(), false, false, 2, null);

        final CompiledPivot compiled = compile(new PivotRequest("sales", config));

        assertThat(compiled.rowLimit()).isEqualTo(2);
        assertThat(compiled.leafQuery().sql()).endsWith(" LIMIT 3");
        assertThat(compiled.countQuery().sql()).isEqualTo(
            "SELECT COUNT(*) AS \"__total\" FROM (SELECT \"region\" FROM \"sales\" GROUP BY \"region\") AS \"__groups\"");
    }

    @Test
    void rowLimitIsNotPushedForNestedRows() {
        final PivotConfiguration config = new PivotConfiguration(List.of(REGION, PRODUCT), List.of(),
            List.of(sum(REVENUE)), List.of(), false, false, 2, null);

        final CompiledPivot compiled = compile(new PivotRequest("sales", config));

        assertThat(compiled.isRowLimitPushedDown()).isFalse();
        assertThat(compiled.leafQuery().sql()).endsWith(" LIMIT 1001");
    }

    @Test
    void passThroughSelectsRawRowsCappedByCeiling() {
        final CompiledPivot compiled = compile(new PivotRequest("sales", config(List.of(REGION), List.of(), List.of())));

        assertThat(compiled.mode()).isEqualTo(CompiledPivot.Mode.PASS_THROUGH);
        assertThat(compiled.leafQuery().sql()).isEqualTo("SELECT * FROM \"sales\" LIMIT 1001");
        assertThat(compiled.rowLimit()).isEqualTo(1000);
        assertThat(compiled.countQuery().sql()).isEqualTo("SELECT COUNT(*) AS \"__total\" FROM \"sales\"");
    }

    @Test
    void fieldValuesAreDistinctNonNullAndSorted() {
        final CompiledQuery query = compiler.compileFieldValues(SALES, REGION, 50);

        assertThat(query.sql()).isEqualTo(
            "SELECT DISTINCT \"region\" FROM \"sales\" WHERE \"region\" IS NOT NULL ORDER BY \"region\" ASC LIMIT 50");
        assertThat(query.parameters()).isEmpty();
    }

    @Test
    void neededDepthsCoverExpandedChildrenSubtotalsAndTotals() {
        final PivotConfiguration plain = config(List.of(REGION, PRODUCT, QUARTER), List.of(), List.of(sum(REVENUE)));
        final PivotConfiguration totals = config(List.of(REGION, PRODUCT, QUARTER), List.of(), List.of(sum(REVENUE)), true, true);

        assertThat(PivotQueryCompiler.neededDepths(0, Set.of(), plain)).containsExactly(0);
        assertThat(PivotQueryCompiler.neededDepths(3, Set.of(), plain)).containsExactly(1, 3);
        assertThat(PivotQueryCompiler.neededDepths(3, Set.of(List.of("US")), plain)).containsExactly(1, 2, 3);
        assertThat(PivotQueryCompiler.neededDepths(3, Set.of(List.of("US", "Widget")), totals)).containsExactly(0, 1, 2, 3);
    }
}
