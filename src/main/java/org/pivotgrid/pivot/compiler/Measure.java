package org.pivotgrid.pivot.compiler;

import org.pivotgrid.pivot.api.AggregationType;
import org.pivotgrid.pivot.api.DataType;

/**
 * A compiled measure.
 *
 * @param label       unique display label, also used as the SQL alias
 * @param expression  SQL aggregate expression
 * @param aggregation the aggregation function
 * @param fieldId     aggregated field id, {@code null} for {@code COUNT(*)}
 * @param resultType  data type of the aggregated values
 * @param format      display format pattern, may be {@code null}
 */
public record Measure(
    String label,
    String expression,
    AggregationType aggregation,
    String fieldId,
    DataType resultType,
    String format
) {
}
