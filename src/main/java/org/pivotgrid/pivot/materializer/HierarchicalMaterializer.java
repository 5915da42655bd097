package org.pivotgrid.pivot.materializer;

import org.pivotgrid.pivot.api.CellType;
import org.pivotgrid.pivot.api.Field;
import org.pivotgrid.pivot.api.HeaderNode;
import org.pivotgrid.pivot.api.PivotCell;
import org.pivotgrid.pivot.api.PivotConfiguration;
import org.pivotgrid.pivot.api.PivotException;
import org.pivotgrid.pivot.api.PivotStructure;
import org.pivotgrid.pivot.api.PivotValue;
import org.pivotgrid.pivot.api.QueryResult;
import org.pivotgrid.pivot.compiler.CompiledPivot;
import org.pivotgrid.pivot.compiler.GroupingLevel;
import org.pivotgrid.pivot.compiler.Measure;
import org.pivotgrid.pivot.compiler.ResolvedPivot;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Turns the grouping query results of an aggregate pivot into a rendered table.
 *
 * <p>The leaf result defines both hierarchies. Every rendered row and column is a unit of one
 * hierarchy: a visible node, the subtotal of an expanded node, the grand total, or the single
 * unit of an axis without fields. The value of a cell is read from the result of the grouping
 * level the two units belong to, keyed by their combined path. Combinations without data render
 * as {@link PivotValue#NULL} with an empty formatted value.</p>
 *
 * <p>{@code maxRows} and {@code maxColumns} cap the body units in header order; grand totals are
 * appended after truncation and always cover the full result.</p>
 */
public final class HierarchicalMaterializer {

    private final PassThroughMaterializer passThroughMaterializer = new PassThroughMaterializer();

    /**
     * @param compiled     the compiled pivot
     * @param results      one result per grouping level of {@code compiled}
     * @param fullRowCount row count of the untruncated result when the row cap was pushed into SQL
     *                     and the leaf query overflowed, otherwise {@code null}
     */
    public MaterializedPivot materialize(final CompiledPivot compiled, final Map<GroupingLevel, QueryResult> results,
                                         final Long fullRowCount) {
        if (compiled.mode() == CompiledPivot.Mode.PASS_THROUGH) {
            return passThroughMaterializer.materialize(compiled, results.get(compiled.leafLevel()), fullRowCount);
        }
        return new Run(compiled, results, fullRowCount).materialize();
    }

    /**
     * State of one materialization.
     */
    private static final class Run {
        private final ResolvedPivot pivot;
        private final PivotConfiguration config;
        private final CompiledPivot compiled;
        private final Map<GroupingLevel, QueryResult> results;
        private final Long fullRowCount;
        private final CellFormatter formatter = new CellFormatter();
        private final int rowDepth;
        private final int columnDepth;
        private final List<Measure> measures;
        private final boolean measureHeaders;
        private final Map<GroupingLevel, Map<List<String>, List<PivotValue>>> levelIndex = new HashMap<>();

        Run(final CompiledPivot compiled, final Map<GroupingLevel, QueryResult> results, final Long fullRowCount) {
            this.compiled = compiled;
            this.pivot = compiled.pivot();
            this.config = pivot.configuration();
            this.results = results;
            this.fullRowCount = fullRowCount;
            this.rowDepth = pivot.rowDepth();
            this.columnDepth = pivot.columnDepth();
            this.measures = pivot.measures();
            this.measureHeaders = measures.size() > 1 || columnDepth == 0;
        }

        MaterializedPivot materialize() {
            List<List<PivotValue>> leafRows = leafResult().rows();
            boolean hasMore = false;
            long totalGroups = leafRows.size();
            if (compiled.isRowLimitPushedDown() && leafRows.size() > compiled.rowLimit()) {
                leafRows = leafRows.subList(0, compiled.rowLimit());
                hasMore = true;
                totalGroups = fullRowCount != null ? fullRowCount : leafRows.size();
            }

            indexLevels(leafRows);

            // the leaf query orders by row keys first, so only the column axis needs sorting
            final AxisNode rowRoot = AxisNode.build(leafRows, 0, rowDepth, false);
            final AxisNode columnRoot = AxisNode.build(leafRows, rowDepth, columnDepth, true);

            // rows
            final List<AxisUnit> rowBody = layout(rowRoot, rowDepth, pivot::isRowExpanded);
            final long totalBodyRows = compiled.isRowLimitPushedDown() ? totalGroups : rowBody.size();
            List<AxisUnit> rows = rowBody;
            if (config.maxRows() != null && rows.size() > config.maxRows()) {
                rows = rows.subList(0, config.maxRows());
                hasMore = true;
            }
            rows = new ArrayList<>(rows);
            final boolean rowGrandTotal = config.showGrandTotals() && rowDepth > 0;
            if (rowGrandTotal) {
                rows.add(new AxisUnit(AxisUnit.Kind.GRAND_TOTAL, rowRoot));
            }

            // columns, one slot per unit and measure
            final List<ColumnSlot> columnBody = new ArrayList<>();
            for (final AxisUnit unit : layout(columnRoot, columnDepth, pivot::isColumnExpanded)) {
                for (int m = 0; m < measures.size(); m++) {
                    columnBody.add(new ColumnSlot(unit, m));
                }
            }
            final long totalBodyColumns = columnBody.size();
            List<ColumnSlot> columns = columnBody;
            if (config.maxColumns() != null && columns.size() > config.maxColumns()) {
                columns = columns.subList(0, config.maxColumns());
                hasMore = true;
            }
            columns = new ArrayList<>(columns);
            final boolean columnGrandTotal = config.showGrandTotals() && columnDepth > 0;
            if (columnGrandTotal) {
                final AxisUnit grand = new AxisUnit(AxisUnit.Kind.GRAND_TOTAL, columnRoot);
                for (int m = 0; m < measures.size(); m++) {
                    columns.add(new ColumnSlot(grand, m));
                }
            }

            final List<List<PivotCell>> matrix = new ArrayList<>(rows.size());
            for (final AxisUnit row : rows) {
                final List<PivotCell> cells = new ArrayList<>(columns.size());
                for (final ColumnSlot column : columns) {
                    cells.add(cell(row, column, rowRoot, columnRoot));
                }
                matrix.add(cells);
            }

            final List<AxisUnit> columnUnits = new ArrayList<>(columns.size());
            columns.forEach(slot -> columnUnits.add(slot.unit()));

            final PivotStructure structure = new PivotStructure(
                matrix,
                headers(rows, null, pivot.rows(), rowDepth, pivot::isRowExpanded),
                headers(columnUnits, columns, pivot.columns(), columnDepth, pivot::isColumnExpanded),
                rows.size(),
                columns.size(),
                totalBodyRows + (rowGrandTotal ? 1 : 0),
                totalBodyColumns + (columnGrandTotal ? measures.size() : 0));
            return new MaterializedPivot(structure, hasMore, totalGroups);
        }

        private QueryResult leafResult() {
            final QueryResult leaf = results.get(compiled.leafLevel());
            if (leaf == null) {
                throw PivotException.compilationFailed("No result for leaf level " + compiled.leafLevel());
            }
            return leaf;
        }

        private void indexLevels(final List<List<PivotValue>> leafRows) {
            for (final GroupingLevel level : compiled.queries().keySet()) {
                final List<List<PivotValue>> rows = level.equals(compiled.leafLevel())
                    ? leafRows
                    : results.get(level).rows();
                final int keys = level.rowDepth() + level.columnDepth();
                final Map<List<String>, List<PivotValue>> index = new HashMap<>();
                for (final List<PivotValue> row : rows) {
                    final List<String> key = new ArrayList<>(keys);
                    for (int k = 0; k < keys; k++) {
                        key.add(row.get(k).toPathElement());
                    }
                    index.put(key, row.subList(keys, row.size()));
                }
                levelIndex.put(level, index);
            }
        }

        /**
         * Lists the body units of one axis in header order. An expanded node contributes its
         * children, followed by its subtotal when subtotals are shown; any other node contributes
         * itself.
         */
        private List<AxisUnit> layout(final AxisNode root, final int depth, final Predicate<List<String>> expanded) {
            final List<AxisUnit> units = new ArrayList<>();
            if (depth == 0) {
                units.add(new AxisUnit(AxisUnit.Kind.ALL, root));
                return units;
            }
            for (final AxisNode child : root.children()) {
                emit(child, depth, expanded, units);
            }
            return units;
        }

        private void emit(final AxisNode node, final int depth, final Predicate<List<String>> expanded,
                          final List<AxisUnit> units) {
            if (node.depth() < depth && expanded.test(node.path())) {
                for (final AxisNode child : node.children()) {
                    emit(child, depth, expanded, units);
                }
                if (config.showSubtotals()) {
                    units.add(new AxisUnit(AxisUnit.Kind.SUBTOTAL, node));
                }
            } else {
                units.add(new AxisUnit(AxisUnit.Kind.NODE, node));
            }
        }

        private PivotCell cell(final AxisUnit row, final ColumnSlot column, final AxisNode rowRoot,
                               final AxisNode columnRoot) {
            final AxisUnit col = column.unit();
            final GroupingLevel level = new GroupingLevel(row.valueDepth(), col.valueDepth());
            final Map<List<String>, List<PivotValue>> index = levelIndex.get(level);
            if (index == null) {
                throw PivotException.compilationFailed("No grouping query compiled for level " + level);
            }

            final List<String> path = new ArrayList<>(row.path());
            path.addAll(col.path());
            final List<PivotValue> values = index.get(path);
            final PivotValue value = values == null ? PivotValue.NULL : values.get(column.measure());
            final Measure measure = measures.get(column.measure());

            final BitSet covered = (BitSet) nodeOf(row, rowRoot).leafRows().clone();
            covered.and(nodeOf(col, columnRoot).leafRows());
            final List<Integer> originalRows = new ArrayList<>(covered.cardinality());
            covered.stream().forEach(originalRows::add);

            final boolean nodeRow = row.kind() == AxisUnit.Kind.NODE;
            final boolean subtotalRow = row.kind() == AxisUnit.Kind.SUBTOTAL;
            final boolean expandable = subtotalRow || (nodeRow && row.node().depth() < rowDepth);
            final boolean expanded = subtotalRow || (expandable && pivot.isRowExpanded(row.path()));

            return new PivotCell(
                value,
                formatter.format(value, measure.format()),
                row.cellType(rowDepth, config.showSubtotals()).max(col.cellType(columnDepth, config.showSubtotals())),
                nodeRow || subtotalRow ? row.node().depth() - 1 : null,
                expandable,
                expanded,
                path,
                originalRows);
        }

        private static AxisNode nodeOf(final AxisUnit unit, final AxisNode root) {
            return unit.kind() == AxisUnit.Kind.NODE || unit.kind() == AxisUnit.Kind.SUBTOTAL ? unit.node() : root;
        }

        /**
         * Builds the header grid of one axis: one list per level, consecutive units with the same
         * owner at a level merged into one header.
         *
         * @param units  rendered units, one per leaf row/column
         * @param slots  the column slots matching {@code units}, or {@code null} for rows
         */
        private List<List<HeaderNode>> headers(final List<AxisUnit> units, final List<ColumnSlot> slots,
                                               final List<Field> fields, final int depth,
                                               final Predicate<List<String>> expanded) {
            final boolean withMeasures = slots != null && measureHeaders;
            int levels = depth;
            if (withMeasures) {
                for (final AxisUnit unit : units) {
                    levels = Math.max(levels, unit.labelLevel() + 2);
                }
            }

            final List<List<HeaderNode>> grid = new ArrayList<>(levels);
            for (int level = 0; level < levels; level++) {
                final List<HeaderNode> headers = new ArrayList<>();
                Owner open = null;
                int start = 0;
                for (int i = 0; i <= units.size(); i++) {
                    final Owner owner = i < units.size() ? ownerAt(units.get(i), level, withMeasures, i) : null;
                    if (open != null && !open.equals(owner)) {
                        headers.add(header(open, level, start, i - start, units.get(start), slots, fields, depth, expanded));
                        open = null;
                    }
                    if (open == null && owner != null) {
                        open = owner;
                        start = i;
                    }
                }
                grid.add(headers);
            }
            return grid;
        }

        private static Owner ownerAt(final AxisUnit unit, final int level, final boolean withMeasures, final int index) {
            switch (unit.kind()) {
                case NODE:
                    if (level < unit.node().depth()) {
                        return new Owner(OwnerKind.NODE, unit.node().ancestorAt(level + 1), -1);
                    }
                    break;
                case SUBTOTAL:
                    if (level < unit.node().depth()) {
                        return new Owner(OwnerKind.NODE, unit.node().ancestorAt(level + 1), -1);
                    }
                    if (level == unit.node().depth()) {
                        return new Owner(OwnerKind.SUBTOTAL, unit.node(), -1);
                    }
                    break;
                case GRAND_TOTAL:
                    if (level == 0) {
                        return new Owner(OwnerKind.GRAND_TOTAL, unit.node(), -1);
                    }
                    break;
                default:
                    break;
            }
            if (withMeasures && level == unit.labelLevel() + 1) {
                return new Owner(OwnerKind.MEASURE, unit.node(), index);
            }
            return null;
        }

        private HeaderNode header(final Owner owner, final int level, final int start, final int span,
                                  final AxisUnit firstUnit, final List<ColumnSlot> slots, final List<Field> fields,
                                  final int depth, final Predicate<List<String>> expanded) {
            final AxisNode node = owner.node();
            switch (owner.kind()) {
                case NODE: {
                    final Field field = fields.get(level);
                    final boolean expandable = node.depth() < depth;
                    final boolean isExpanded = expandable && expanded.test(node.path());
                    final CellType type = expandable && !isExpanded && config.showSubtotals() ? CellType.SUBTOTAL : CellType.DATA;
                    return new HeaderNode(formatter.label(node.key(), field.format()), level, span, start,
                        node.path(), field.id(), expandable, isExpanded, type);
                }
                case SUBTOTAL: {
                    final String label = formatter.label(node.key(), fields.get(node.depth() - 1).format()) + " Total";
                    return new HeaderNode(label, level, span, start, node.path(), null, true, true, CellType.SUBTOTAL);
                }
                case GRAND_TOTAL:
                    return new HeaderNode("Total", level, span, start, List.of(), null, false, false, CellType.GRAND_TOTAL);
                case MEASURE:
                default: {
                    final Measure measure = measures.get(slots.get(start).measure());
                    return new HeaderNode(measure.label(), level, span, start, firstUnit.path(), measure.fieldId(),
                        false, false, firstUnit.cellType(depth, config.showSubtotals()));
                }
            }
        }
    }

    private record ColumnSlot(AxisUnit unit, int measure) {
    }

    private enum OwnerKind { NODE, SUBTOTAL, GRAND_TOTAL, MEASURE }

    /**
     * What a header cell belongs to. Measure owners carry the slot index so they never merge.
     */
    private record Owner(OwnerKind kind, AxisNode node, int slot) {
    }
}
