package org.pivotgrid.pivot.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A single matrix cell.
 *
 * @param value          typed value, {@link PivotValue#NULL} when the combination has no data
 * @param formattedValue display text, empty for missing values
 * @param type           data, subtotal or grand total
 * @param level          depth of the row node this cell belongs to, absent for grand totals
 * @param expandable     whether the row node can be expanded
 * @param expanded       whether the row node is expanded
 * @param path           row key path followed by column key path
 * @param originalRows   indices of the leaf result rows aggregated into this cell
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PivotCell(
    PivotValue value,
    String formattedValue,
    CellType type,
    Integer level,
    @JsonProperty("isExpandable") boolean expandable,
    @JsonProperty("isExpanded") boolean expanded,
    List<String> path,
    List<Integer> originalRows
) {

    public PivotCell {
        path = PivotRequest.copyPath(path);
        originalRows = List.copyOf(originalRows);
    }
}
