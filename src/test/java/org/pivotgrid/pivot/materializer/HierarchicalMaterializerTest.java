package org.pivotgrid.pivot.materializer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pivotgrid.pivot.api.AggregationType;
import org.pivotgrid.pivot.api.CellType;
import org.pivotgrid.pivot.api.HeaderNode;
import org.pivotgrid.pivot.api.PivotCell;
import org.pivotgrid.pivot.api.PivotConfiguration;
import org.pivotgrid.pivot.api.PivotRequest;
import org.pivotgrid.pivot.api.PivotStructure;
import org.pivotgrid.pivot.api.PivotValue;
import org.pivotgrid.pivot.api.QueryResult;
import org.pivotgrid.pivot.api.ValueField;
import org.pivotgrid.pivot.compiler.AggregationClauseCompiler;
import org.pivotgrid.pivot.compiler.CompiledPivot;
import org.pivotgrid.pivot.compiler.FilterClauseCompiler;
import org.pivotgrid.pivot.compiler.GroupingLevel;
import org.pivotgrid.pivot.compiler.PivotQueryCompiler;
import org.pivotgrid.pivot.compiler.RequestValidator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pivotgrid.pivot.PivotFixtures.PRODUCT;
import static org.pivotgrid.pivot.PivotFixtures.QUARTER;
import static org.pivotgrid.pivot.PivotFixtures.REGION;
import static org.pivotgrid.pivot.PivotFixtures.REVENUE;
import static org.pivotgrid.pivot.PivotFixtures.SALES;
import static org.pivotgrid.pivot.PivotFixtures.config;
import static org.pivotgrid.pivot.PivotFixtures.sum;

@Tag("unit")
class HierarchicalMaterializerTest {

    private final RequestValidator validator = new RequestValidator(new AggregationClauseCompiler());
    private final PivotQueryCompiler compiler = new PivotQueryCompiler(new FilterClauseCompiler(), 1000);
    private final HierarchicalMaterializer materializer = new HierarchicalMaterializer();

    private CompiledPivot compile(final PivotRequest request) {
        return compiler.compile(validator.resolve(request, SALES));
    }

    private static PivotValue v(final Object raw) {
        if (raw == null) {
            return PivotValue.NULL;
        }
        if (raw instanceof Integer || raw instanceof Long) {
            return PivotValue.ofNumber(((Number) raw).longValue());
        }
        return PivotValue.ofString(raw.toString());
    }

    private static QueryResult result(final Object[]... rows) {
        final List<List<PivotValue>> values = new ArrayList<>();
        int width = 0;
        for (final Object[] row : rows) {
            final List<PivotValue> converted = new ArrayList<>();
            for (final Object raw : row) {
                converted.add(v(raw));
            }
            width = converted.size();
            values.add(converted);
        }
        final List<String> columns = new ArrayList<>();
        for (int i = 0; i < width; i++) {
            columns.add("c" + i);
        }
        return new QueryResult(columns, values);
    }

    private static Object[] row(final Object... values) {
        return values;
    }

    private static List<String> labels(final List<HeaderNode> headers) {
        final List<String> labels = new ArrayList<>();
        headers.forEach(h -> labels.add(h.label()));
        return labels;
    }

    private static List<String> formatted(final List<PivotCell> cells) {
        final List<String> values = new ArrayList<>();
        cells.forEach(c -> values.add(c.formattedValue()));
        return values;
    }

    private Map<GroupingLevel, QueryResult> regionByQuarterResults() {
        final Map<GroupingLevel, QueryResult> results = new HashMap<>();
        results.put(new GroupingLevel(1, 1), result(
            row("EU", "Q1", 80), row("US", "Q1", 100), row("US", "Q2", 150)));
        results.put(new GroupingLevel(1, 0), result(row("EU", 80), row("US", 250)));
        results.put(new GroupingLevel(0, 1), result(row("Q1", 180), row("Q2", 150)));
        results.put(new GroupingLevel(0, 0), result(row(330)));
        return results;
    }

    @Test
    void crossTabWithGrandTotals() {
        final CompiledPivot compiled = compile(new PivotRequest("sales",
            config(List.of(REGION), List.of(QUARTER), List.of(sum(REVENUE)), false, true)));

        final MaterializedPivot pivot = materializer.materialize(compiled, regionByQuarterResults(), null);
        final PivotStructure s = pivot.structure();

        assertThat(pivot.hasMore()).isFalse();
        assertThat(pivot.totalDataRows()).isEqualTo(3);
        assertThat(s.rowCount()).isEqualTo(3);
        assertThat(s.columnCount()).isEqualTo(3);
        assertThat(s.totalRows()).isEqualTo(3);
        assertThat(s.totalColumns()).isEqualTo(3);

        assertThat(s.rowHeaders()).hasSize(1);
        assertThat(labels(s.rowHeaders().get(0))).containsExactly("EU", "US", "Total");
        assertThat(s.columnHeaders()).hasSize(1);
        assertThat(labels(s.columnHeaders().get(0))).containsExactly("Q1", "Q2", "Total");

        assertThat(formatted(s.matrix().get(0))).containsExactly("80", "", "80");
        assertThat(formatted(s.matrix().get(1))).containsExactly("100", "150", "250");
        assertThat(formatted(s.matrix().get(2))).containsExactly("180", "150", "330");

        assertThat(s.matrix().get(0).get(1).value()).isEqualTo(PivotValue.NULL);
        assertThat(s.matrix().get(0).get(0).type()).isEqualTo(CellType.DATA);
        assertThat(s.matrix().get(0).get(2).type()).isEqualTo(CellType.GRAND_TOTAL);
        assertThat(s.matrix().get(2).get(0).type()).isEqualTo(CellType.GRAND_TOTAL);
    }

    @Test
    void cellsCarryPathAndContributingLeafRows() {
        final CompiledPivot compiled = compile(new PivotRequest("sales",
            config(List.of(REGION), List.of(QUARTER), List.of(sum(REVENUE)), false, true)));

        final PivotStructure s = materializer.materialize(compiled, regionByQuarterResults(), null).structure();

        final PivotCell euQ1 = s.matrix().get(0).get(0);
        assertThat(euQ1.path()).containsExactly("EU", "Q1");
        assertThat(euQ1.originalRows()).containsExactly(0);
        assertThat(euQ1.level()).isEqualTo(0);

        final PivotCell usTotal = s.matrix().get(1).get(2);
        assertThat(usTotal.path()).containsExactly("US");
        assertThat(usTotal.originalRows()).containsExactly(1, 2);

        final PivotCell grand = s.matrix().get(2).get(2);
        assertThat(grand.path()).isEmpty();
        assertThat(grand.originalRows()).containsExactly(0, 1, 2);
        assertThat(grand.level()).isNull();
    }

    @Test
    void collapsedAndExpandedNodesWithSubtotals() {
        final PivotRequest request = new PivotRequest("sales",
            config(List.of(REGION, PRODUCT), List.of(), List.of(sum(REVENUE)), true, false),
            Set.of(List.of("US")), Set.of());
        final CompiledPivot compiled = compile(request);

        final Map<GroupingLevel, QueryResult> results = new HashMap<>();
        results.put(new GroupingLevel(2, 0), result(
            row("EU", "Gadget", 30), row("EU", "Widget", 50), row("US", "Gadget", 40), row("US", "Widget", 60)));
        results.put(new GroupingLevel(1, 0), result(row("EU", 80), row("US", 100)));

        final PivotStructure s = materializer.materialize(compiled, results, null).structure();

        assertThat(s.rowCount()).isEqualTo(4);
        assertThat(s.matrix()).extracting(cells -> cells.get(0).formattedValue())
            .containsExactly("80", "40", "60", "100");
        assertThat(s.matrix()).extracting(cells -> cells.get(0).type())
            .containsExactly(CellType.SUBTOTAL, CellType.DATA, CellType.DATA, CellType.SUBTOTAL);

        final PivotCell eu = s.matrix().get(0).get(0);
        assertThat(eu.expandable()).isTrue();
        assertThat(eu.expanded()).isFalse();
        assertThat(eu.level()).isEqualTo(0);
        final PivotCell usGadget = s.matrix().get(1).get(0);
        assertThat(usGadget.expandable()).isFalse();
        assertThat(usGadget.level()).isEqualTo(1);
        final PivotCell usSubtotal = s.matrix().get(3).get(0);
        assertThat(usSubtotal.expanded()).isTrue();
        assertThat(usSubtotal.path()).containsExactly("US");

        assertThat(s.rowHeaders()).hasSize(2);
        final List<HeaderNode> top = s.rowHeaders().get(0);
        assertThat(labels(top)).containsExactly("EU", "US");
        assertThat(top.get(0).span()).isEqualTo(1);
        assertThat(top.get(0).expandable()).isTrue();
        assertThat(top.get(0).expanded()).isFalse();
        assertThat(top.get(1).span()).isEqualTo(3);
        assertThat(top.get(1).start()).isEqualTo(1);
        assertThat(top.get(1).expanded()).isTrue();
        assertThat(top.get(1).field()).isEqualTo("region");

        final List<HeaderNode> second = s.rowHeaders().get(1);
        assertThat(labels(second)).containsExactly("Gadget", "Widget", "US Total");
        assertThat(second).extracting(HeaderNode::start).containsExactly(1, 2, 3);
        assertThat(second.get(2).type()).isEqualTo(CellType.SUBTOTAL);

        // a single measure over no column fields gets a measure header
        assertThat(s.columnHeaders()).hasSize(1);
        assertThat(labels(s.columnHeaders().get(0)))
            .containsExactly(compiled.pivot().measures().get(0).label());
    }

    @Test
    void collapsedNodesWithoutSubtotalsRenderAsData() {
        final CompiledPivot compiled = compile(new PivotRequest("sales",
            config(List.of(REGION, PRODUCT), List.of(), List.of(sum(REVENUE)))));

        final Map<GroupingLevel, QueryResult> results = new HashMap<>();
        results.put(new GroupingLevel(2, 0), result(
            row("EU", "Gadget", 30), row("EU", "Widget", 50), row("US", "Gadget", 40)));
        results.put(new GroupingLevel(1, 0), result(row("EU", 80), row("US", 40)));

        final PivotStructure s = materializer.materialize(compiled, results, null).structure();

        assertThat(s.matrix()).extracting(cells -> cells.get(0).formattedValue()).containsExactly("80", "40");
        assertThat(s.matrix()).extracting(cells -> cells.get(0).type())
            .containsExactly(CellType.DATA, CellType.DATA);
        assertThat(s.rowHeaders().get(1)).isEmpty();
    }

    @Test
    void expandedColumnsShowChildren() {
        final PivotRequest request = new PivotRequest("sales",
            config(List.of(), List.of(REGION, PRODUCT), List.of(sum(REVENUE))),
            Set.of(), Set.of(List.of("EU")));
        final CompiledPivot compiled = compile(request);

        final Map<GroupingLevel, QueryResult> results = new HashMap<>();
        results.put(new GroupingLevel(0, 2), result(
            row("EU", "Gadget", 30), row("EU", "Widget", 50), row("US", "Gadget", 40)));
        results.put(new GroupingLevel(0, 1), result(row("EU", 80), row("US", 40)));

        final PivotStructure s = materializer.materialize(compiled, results, null).structure();

        // no row fields: one row aggregating everything
        assertThat(s.rowCount()).isEqualTo(1);
        assertThat(s.rowHeaders()).isEmpty();
        assertThat(formatted(s.matrix().get(0))).containsExactly("30", "50", "40");
        assertThat(labels(s.columnHeaders().get(0))).containsExactly("EU", "US");
        assertThat(s.columnHeaders().get(0).get(0).span()).isEqualTo(2);
        assertThat(labels(s.columnHeaders().get(1))).containsExactly("Gadget", "Widget");
    }

    @Test
    void nullKeysRenderWithPlaceholderLabel() {
        final CompiledPivot compiled = compile(new PivotRequest("sales",
            config(List.of(REGION), List.of(), List.of(sum(REVENUE)))));

        final Map<GroupingLevel, QueryResult> results = new HashMap<>();
        results.put(new GroupingLevel(1, 0), result(row("EU", 3), row("US", 7), row(null, 5)));

        final PivotStructure s = materializer.materialize(compiled, results, null).structure();

        assertThat(labels(s.rowHeaders().get(0))).containsExactly("EU", "US", PivotValue.NULL_LABEL);
        assertThat(s.rowHeaders().get(0).get(2).path()).isEqualTo(Arrays.asList((String) null));
        assertThat(s.matrix().get(2).get(0).formattedValue()).isEqualTo("5");
    }

    @Test
    void rowsKeepEngineOrderWhileColumnsAreSorted() {
        final CompiledPivot compiled = compile(new PivotRequest("sales",
            config(List.of(REGION), List.of(QUARTER), List.of(sum(REVENUE)))));

        // a case-insensitive collation puts "apac" before "EU"
        final Map<GroupingLevel, QueryResult> results = new HashMap<>();
        results.put(new GroupingLevel(1, 1), result(
            row("apac", "Q2", 10), row("EU", "Q1", 80), row("EU", "Q2", 20)));

        final PivotStructure s = materializer.materialize(compiled, results, null).structure();

        assertThat(labels(s.rowHeaders().get(0))).containsExactly("apac", "EU");
        assertThat(labels(s.columnHeaders().get(0))).containsExactly("Q1", "Q2");
        assertThat(formatted(s.matrix().get(0))).containsExactly("", "10");
        assertThat(formatted(s.matrix().get(1))).containsExactly("80", "20");
    }

    @Test
    void measureFormatAppliesToCells() {
        final ValueField formattedSum = new ValueField(REVENUE, AggregationType.SUM, "#,##0.00", null);
        final CompiledPivot compiled = compile(new PivotRequest("sales",
            config(List.of(REGION), List.of(), List.of(formattedSum))));

        final Map<GroupingLevel, QueryResult> results = new HashMap<>();
        results.put(new GroupingLevel(1, 0), result(row("US", 1234567)));

        final PivotStructure s = materializer.materialize(compiled, results, null).structure();

        assertThat(s.matrix().get(0).get(0).formattedValue()).isEqualTo("1,234,567.00");
        assertThat(s.matrix().get(0).get(0).value()).isEqualTo(PivotValue.ofNumber(1234567));
    }

    @Test
    void pushedDownRowLimitUsesFullCountAndKeepsGrandTotal() {
        final PivotConfiguration config = new PivotConfiguration(List.of(REGION), List.of(),
            List.of(sum(REVENUE)), List.of(), false, true, 1, null);
        final CompiledPivot compiled = compile(new PivotRequest("sales", config));
        assertThat(compiled.isRowLimitPushedDown()).isTrue();

        final Map<GroupingLevel, QueryResult> results = new HashMap<>();
        results.put(new GroupingLevel(1, 0), result(row("EU", 80), row("US", 250)));
        results.put(new GroupingLevel(0, 0), result(row(330)));

        final MaterializedPivot pivot = materializer.materialize(compiled, results, 5L);
        final PivotStructure s = pivot.structure();

        assertThat(pivot.hasMore()).isTrue();
        assertThat(pivot.totalDataRows()).isEqualTo(5);
        assertThat(labels(s.rowHeaders().get(0))).containsExactly("EU", "Total");
        assertThat(formatted(s.matrix().get(1))).containsExactly("330");
        assertThat(s.rowCount()).isEqualTo(2);
        assertThat(s.totalRows()).isEqualTo(6);
    }

    @Test
    void rowCountsBeyondIntRangeAreKept() {
        final PivotConfiguration grouped = new PivotConfiguration(List.of(REGION), List.of(),
            List.of(sum(REVENUE)), List.of(), false, false, 1, null);
        final Map<GroupingLevel, QueryResult> results = new HashMap<>();
        results.put(new GroupingLevel(1, 0), result(row("EU", 80), row("US", 250)));

        final MaterializedPivot pushedDown = materializer.materialize(
            compile(new PivotRequest("sales", grouped)), results, 4_294_967_297L);

        assertThat(pushedDown.totalDataRows()).isEqualTo(4_294_967_297L);
        assertThat(pushedDown.structure().totalRows()).isEqualTo(4_294_967_297L);

        final PivotConfiguration raw = new PivotConfiguration(List.of(REGION), List.of(),
            List.of(), List.of(), false, false, 1, null);
        final CompiledPivot passThrough = compile(new PivotRequest("sales", raw));
        final QueryResult preview = new QueryResult(List.of("region"), List.of(List.of(v("US")), List.of(v("EU"))));

        final MaterializedPivot previewed = materializer.materialize(passThrough,
            Map.of(passThrough.leafLevel(), preview), 3_000_000_000L);

        assertThat(previewed.hasMore()).isTrue();
        assertThat(previewed.structure().rowCount()).isEqualTo(1);
        assertThat(previewed.structure().totalRows()).isEqualTo(3_000_000_000L);
    }

    @Test
    void maxRowsTruncatesHierarchicalRows() {
        final PivotConfiguration config = new PivotConfiguration(List.of(REGION), List.of(QUARTER),
            List.of(sum(REVENUE)), List.of(), false, false, 1, null);
        final CompiledPivot compiled = compile(new PivotRequest("sales", config));
        assertThat(compiled.isRowLimitPushedDown()).isFalse();

        final Map<GroupingLevel, QueryResult> results = new HashMap<>();
        results.put(new GroupingLevel(1, 1), result(
            row("EU", "Q1", 80), row("US", "Q1", 100), row("US", "Q2", 150)));

        final MaterializedPivot pivot = materializer.materialize(compiled, results, null);

        assertThat(pivot.hasMore()).isTrue();
        assertThat(pivot.structure().rowCount()).isEqualTo(1);
        assertThat(pivot.structure().totalRows()).isEqualTo(2);
        assertThat(labels(pivot.structure().rowHeaders().get(0))).containsExactly("EU");
    }

    @Test
    void maxColumnsCountsMeasureSlots() {
        final PivotConfiguration config = new PivotConfiguration(List.of(REGION), List.of(QUARTER),
            List.of(sum(REVENUE), ValueField.of(REVENUE, AggregationType.COUNT)), List.of(), false, false, null, 3);
        final CompiledPivot compiled = compile(new PivotRequest("sales", config));

        final Map<GroupingLevel, QueryResult> results = new HashMap<>();
        results.put(new GroupingLevel(1, 1), result(
            row("EU", "Q1", 80, 1), row("US", "Q1", 100, 1), row("US", "Q2", 150, 2)));

        final MaterializedPivot pivot = materializer.materialize(compiled, results, null);
        final PivotStructure s = pivot.structure();

        assertThat(pivot.hasMore()).isTrue();
        assertThat(s.columnCount()).isEqualTo(3);
        assertThat(s.totalColumns()).isEqualTo(4);
        assertThat(formatted(s.matrix().get(1))).containsExactly("100", "1", "150");

        assertThat(s.columnHeaders()).hasSize(2);
        final List<HeaderNode> quarters = s.columnHeaders().get(0);
        assertThat(labels(quarters)).containsExactly("Q1", "Q2");
        assertThat(quarters).extracting(HeaderNode::span).containsExactly(2, 1);
        assertThat(s.columnHeaders().get(1)).hasSize(3);
        assertThat(s.columnHeaders().get(1).get(0).label())
            .isEqualTo(compiled.pivot().measures().get(0).label());
        assertThat(s.columnHeaders().get(1).get(1).label())
            .isEqualTo(compiled.pivot().measures().get(1).label());
    }

    @Test
    void passThroughRendersRawRows() {
        final CompiledPivot compiled = compile(new PivotRequest("sales",
            config(List.of(REGION), List.of(), List.of())));
        assertThat(compiled.mode()).isEqualTo(CompiledPivot.Mode.PASS_THROUGH);

        final QueryResult raw = new QueryResult(List.of("region", "revenue", "extra"), List.of(
            List.of(v("US"), v(100), v("x")),
            List.of(v("EU"), v(80), PivotValue.NULL)));

        final MaterializedPivot pivot = materializer.materialize(compiled,
            Map.of(compiled.leafLevel(), raw), null);
        final PivotStructure s = pivot.structure();

        assertThat(pivot.hasMore()).isFalse();
        assertThat(pivot.totalDataRows()).isEqualTo(2);
        assertThat(s.rowHeaders()).isEmpty();
        assertThat(labels(s.columnHeaders().get(0)))
            .containsExactly(REGION.name(), REVENUE.name(), "extra");
        assertThat(formatted(s.matrix().get(1))).containsExactly("EU", "80", "");
        assertThat(s.matrix().get(1).get(0).originalRows()).containsExactly(1);
    }
}
