package org.pivotgrid.pivot.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One header cell in a row or column header grid.
 *
 * @param label      rendered text
 * @param level      header level, 0 = outermost
 * @param span       number of leaf rows/columns covered
 * @param start      index of the first leaf row/column covered
 * @param path       group key path of the node this header belongs to
 * @param field      id of the grouping field at this level, absent for measure and total headers
 * @param expandable whether the node has children that can be shown
 * @param expanded   whether the node's children are currently shown
 * @param type       kind of the slot(s) beneath this header
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HeaderNode(
    String label,
    int level,
    int span,
    int start,
    List<String> path,
    String field,
    @JsonProperty("isExpandable") boolean expandable,
    @JsonProperty("isExpanded") boolean expanded,
    CellType type
) {

    public HeaderNode {
        path = PivotRequest.copyPath(path);
    }
}
