package org.pivotgrid.pivot.compiler;

import org.pivotgrid.pivot.api.Field;
import org.pivotgrid.pivot.api.FilterOperator;

/**
 * An enabled filter bound to its catalog field with a coerced argument.
 */
public record ResolvedFilter(Field field, FilterOperator operator, FilterArgument argument) {
}
