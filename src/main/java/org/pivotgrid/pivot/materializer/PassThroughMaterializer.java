package org.pivotgrid.pivot.materializer;

import org.pivotgrid.pivot.api.CellType;
import org.pivotgrid.pivot.api.DatasetSchema;
import org.pivotgrid.pivot.api.Field;
import org.pivotgrid.pivot.api.HeaderNode;
import org.pivotgrid.pivot.api.PivotCell;
import org.pivotgrid.pivot.api.PivotConfiguration;
import org.pivotgrid.pivot.api.PivotStructure;
import org.pivotgrid.pivot.api.PivotValue;
import org.pivotgrid.pivot.api.QueryResult;
import org.pivotgrid.pivot.compiler.CompiledPivot;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Renders an unaggregated preview: one matrix row per raw row, one flat column header per
 * dataset column, no row headers.
 */
final class PassThroughMaterializer {

    MaterializedPivot materialize(final CompiledPivot compiled, final QueryResult result, final Long fullRowCount) {
        final PivotConfiguration config = compiled.pivot().configuration();
        final DatasetSchema schema = compiled.pivot().schema();
        final CellFormatter formatter = new CellFormatter();

        List<List<PivotValue>> rows = result.rows();
        boolean hasMore = false;
        long totalRows = rows.size();
        if (compiled.isRowLimitPushedDown() && rows.size() > compiled.rowLimit()) {
            rows = rows.subList(0, compiled.rowLimit());
            hasMore = true;
            totalRows = fullRowCount != null ? fullRowCount : rows.size();
        }

        final List<String> columnLabels = result.columns();
        int columnCount = columnLabels.size();
        if (config.maxColumns() != null && columnCount > config.maxColumns()) {
            columnCount = config.maxColumns();
            hasMore = true;
        }

        final List<Field> fields = new ArrayList<>(columnCount);
        final List<HeaderNode> headers = new ArrayList<>(columnCount);
        for (int c = 0; c < columnCount; c++) {
            final String label = columnLabels.get(c);
            final Optional<Field> field = schema.field(label);
            fields.add(field.orElse(null));
            headers.add(new HeaderNode(field.map(Field::name).orElse(label), 0, 1, c, List.of(), label,
                false, false, CellType.DATA));
        }

        final List<List<PivotCell>> matrix = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            final List<PivotValue> row = rows.get(r);
            final List<PivotCell> cells = new ArrayList<>(columnCount);
            for (int c = 0; c < columnCount; c++) {
                final PivotValue value = row.get(c);
                final String format = fields.get(c) != null ? fields.get(c).format() : null;
                cells.add(new PivotCell(value, formatter.format(value, format), CellType.DATA, null,
                    false, false, List.of(), List.of(r)));
            }
            matrix.add(cells);
        }

        final PivotStructure structure = new PivotStructure(
            matrix,
            List.of(),
            List.of(headers),
            matrix.size(),
            columnCount,
            totalRows,
            columnLabels.size());
        return new MaterializedPivot(structure, hasMore, totalRows);
    }
}
