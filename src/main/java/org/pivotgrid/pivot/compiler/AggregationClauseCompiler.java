package org.pivotgrid.pivot.compiler;

import org.pivotgrid.pivot.api.AggregationType;
import org.pivotgrid.pivot.api.DataType;
import org.pivotgrid.pivot.api.Field;
import org.pivotgrid.pivot.api.PivotException;
import org.pivotgrid.pivot.api.ValueField;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps value fields to SQL aggregate expressions and assigns each measure a unique label.
 */
public final class AggregationClauseCompiler {

    /** Label of the implicit measure used when columns are pivoted without any value field. */
    public static final String DEFAULT_COUNT_LABEL = "Count";

    /**
     * Compiles the measures of a pivot.
     *
     * @param values     value fields, already bound to catalog fields
     * @param hasColumns whether column fields are present
     * @return the measures in request order; a single {@code COUNT(*)} when {@code values} is
     *         empty but columns are pivoted; empty for a pass-through projection
     */
    public List<Measure> compile(final List<ValueField> values, final boolean hasColumns) {
        if (values.isEmpty()) {
            if (hasColumns) {
                return List.of(new Measure(DEFAULT_COUNT_LABEL, "COUNT(*)", AggregationType.COUNT, null, DataType.NUMBER, null));
            }
            return List.of();
        }

        final Set<String> used = new HashSet<>();
        final List<Measure> measures = new ArrayList<>(values.size());
        for (final ValueField value : values) {
            final Field field = value.field();
            checkApplicable(value);
            final String label = uniqueLabel(value, used);
            final DataType resultType = resultType(value);
            final String format = value.format() != null
                ? value.format()
                : (resultType == field.dataType() ? field.format() : null);
            measures.add(new Measure(label, expression(value.aggregation(), field), value.aggregation(),
                field.id(), resultType, format));
        }
        return measures;
    }

    static String expression(final AggregationType aggregation, final Field field) {
        final String column = SqlIdentifiers.quote(field.id());
        return switch (aggregation) {
            case SUM -> "SUM(" + column + ")";
            case COUNT -> "COUNT(" + column + ")";
            case AVG -> "AVG(CAST(" + column + " AS DOUBLE PRECISION))";
            case MIN -> "MIN(" + column + ")";
            case MAX -> "MAX(" + column + ")";
            case COUNT_DISTINCT -> "COUNT(DISTINCT " + column + ")";
        };
    }

    static DataType resultType(final ValueField value) {
        return switch (value.aggregation()) {
            case SUM, AVG, COUNT, COUNT_DISTINCT -> DataType.NUMBER;
            case MIN, MAX -> value.field().dataType();
        };
    }

    private static void checkApplicable(final ValueField value) {
        final AggregationType aggregation = value.aggregation();
        if ((aggregation == AggregationType.SUM || aggregation == AggregationType.AVG)
            && value.field().dataType() != DataType.NUMBER) {
            throw PivotException.compilationFailed(String.format(
                "Aggregation '%s' requires a numeric field but '%s' is %s",
                aggregation.wireName(), value.field().id(), value.field().dataType().wireName()));
        }
    }

    private static String uniqueLabel(final ValueField value, final Set<String> used) {
        final Field field = value.field();
        final String base = value.displayName() != null && !value.displayName().isBlank()
            ? value.displayName()
            : (field.name() != null ? field.name() : Field.displayNameOf(field.id()));

        final List<String> candidates = List.of(
            base,
            base + " (" + field.id() + ")",
            base + " (" + field.id() + " " + value.aggregation().wireName() + ")");
        for (final String candidate : candidates) {
            if (used.add(candidate)) {
                return candidate;
            }
        }
        int n = 2;
        while (!used.add(base + " #" + n)) {
            n++;
        }
        return base + " #" + n;
    }
}
