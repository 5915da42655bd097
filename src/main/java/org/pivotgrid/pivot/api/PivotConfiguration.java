package org.pivotgrid.pivot.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * The declarative layout of a pivot: grouping fields per axis, measures, filters and display
 * switches. List order is significant everywhere.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PivotConfiguration(
    @JsonAlias("rowFields") List<Field> rows,
    @JsonAlias("columnFields") List<Field> columns,
    List<ValueField> values,
    List<FilterSpec> filters,
    boolean showSubtotals,
    boolean showGrandTotals,
    Integer maxRows,
    Integer maxColumns
) {

    public PivotConfiguration {
        rows = rows == null ? List.of() : List.copyOf(rows);
        columns = columns == null ? List.of() : List.copyOf(columns);
        values = values == null ? List.of() : List.copyOf(values);
        filters = filters == null ? List.of() : List.copyOf(filters);
        if (maxRows != null && maxRows <= 0) {
            throw new IllegalArgumentException("maxRows must be positive, got " + maxRows);
        }
        if (maxColumns != null && maxColumns <= 0) {
            throw new IllegalArgumentException("maxColumns must be positive, got " + maxColumns);
        }
    }
}
