package org.pivotgrid.pivot.compiler;

import org.pivotgrid.pivot.api.PivotValue;

import java.util.List;

/**
 * A filter value after coercion to the field's data type.
 */
public record FilterArgument(Shape shape, List<PivotValue> values) {

    public enum Shape {
        /** No argument (isEmpty, isNotEmpty). */
        NONE,
        /** Exactly one value. */
        SINGLE,
        /** Zero or more values. */
        LIST,
        /** Two values: lower and upper bound. */
        RANGE
    }

    public FilterArgument {
        values = List.copyOf(values);
    }

    public static FilterArgument none() {
        return new FilterArgument(Shape.NONE, List.of());
    }

    public static FilterArgument single(final PivotValue value) {
        return new FilterArgument(Shape.SINGLE, List.of(value));
    }

    public static FilterArgument list(final List<PivotValue> values) {
        return new FilterArgument(Shape.LIST, values);
    }

    public static FilterArgument range(final PivotValue min, final PivotValue max) {
        return new FilterArgument(Shape.RANGE, List.of(min, max));
    }

    public PivotValue first() {
        return values.get(0);
    }
}
