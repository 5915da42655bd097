package org.pivotgrid.pivot.compiler;

import org.pivotgrid.pivot.api.DataType;
import org.pivotgrid.pivot.api.DatasetSchema;
import org.pivotgrid.pivot.api.Field;
import org.pivotgrid.pivot.api.FilterSpec;
import org.pivotgrid.pivot.api.PivotConfiguration;
import org.pivotgrid.pivot.api.PivotErrorKind;
import org.pivotgrid.pivot.api.PivotException;
import org.pivotgrid.pivot.api.PivotRequest;
import org.pivotgrid.pivot.api.ValueField;
import org.pivotgrid.pivot.materializer.CellFormatter;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Binds a request to the dataset's catalog. Everything that can be rejected without touching
 * the engine is rejected here.
 */
public final class RequestValidator {

    /** Aliases the compiler uses internally; dataset fields must not be named like them. */
    public static final Set<String> RESERVED_IDENTIFIERS = Set.of(
        PivotQueryCompiler.TOTAL_ALIAS, PivotQueryCompiler.GROUPS_ALIAS);

    private final AggregationClauseCompiler aggregationCompiler;

    public RequestValidator(final AggregationClauseCompiler aggregationCompiler) {
        this.aggregationCompiler = aggregationCompiler;
    }

    /**
     * @throws PivotException {@code UnknownField}, {@code InvalidFilterValue} or
     *         {@code QueryCompilationFailed}
     */
    public ResolvedPivot resolve(final PivotRequest request, final DatasetSchema schema) {
        final PivotConfiguration config = request.configuration();

        final List<Field> rows = resolveFields(config.rows(), schema);
        final List<Field> columns = resolveFields(config.columns(), schema);

        final List<ValueField> values = new ArrayList<>(config.values().size());
        for (final ValueField value : config.values()) {
            final Field field = resolve(value.field(), schema);
            final ValueField bound = new ValueField(field, value.aggregation(), value.format(), value.displayName());
            values.add(bound);
        }

        final List<ResolvedFilter> filters = new ArrayList<>();
        for (final FilterSpec filter : config.filters()) {
            if (!filter.enabled()) {
                continue;
            }
            final Field field = resolve(filter.field(), schema);
            filters.add(new ResolvedFilter(field, filter.operator(),
                FilterValues.coerce(field, filter.operator(), filter.value())));
        }

        final List<Measure> measures = aggregationCompiler.compile(values, !columns.isEmpty());
        for (final Measure measure : measures) {
            checkFormat(measure.format(), measure.resultType(), measure.label());
        }

        return new ResolvedPivot(request, schema, rows, columns, measures, filters,
            values.isEmpty() && columns.isEmpty());
    }

    private List<Field> resolveFields(final List<Field> requested, final DatasetSchema schema) {
        final List<Field> resolved = new ArrayList<>(requested.size());
        for (final Field field : requested) {
            resolved.add(resolve(field, schema));
        }
        return resolved;
    }

    /**
     * Looks up the catalog copy of a field. A format given on the request overrides the catalog's.
     */
    private Field resolve(final Field requested, final DatasetSchema schema) {
        final String id = requested.id();
        if (id == null) {
            throw PivotException.unknownField(schema.dataset(), null);
        }
        if (RESERVED_IDENTIFIERS.contains(id)) {
            throw PivotException.compilationFailed("Field id '" + id + "' collides with a reserved alias");
        }
        final Field catalogField = schema.field(id)
            .orElseThrow(() -> PivotException.unknownField(schema.dataset(), id));
        final Field field = requested.format() != null ? catalogField.withFormat(requested.format()) : catalogField;
        checkFormat(field.format(), field.dataType(), field.id());
        return field;
    }

    private static void checkFormat(final String format, final DataType type, final String owner) {
        if (format == null) {
            return;
        }
        try {
            CellFormatter.checkPattern(format, type);
        } catch (final IllegalArgumentException e) {
            throw new PivotException(PivotErrorKind.QUERY_COMPILATION_FAILED,
                "Invalid format '" + format + "' for '" + owner + "': " + e.getMessage(), e);
        }
    }
}
