package org.pivotgrid.pivot.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

/**
 * Expand or collapse one hierarchy node of a previously computed pivot.
 *
 * @param fingerprint fingerprint of the cached pivot to derive from
 * @param path        the node path; {@code null} elements address NULL group keys
 * @param action      expand or collapse
 * @param axis        rows (default) or columns
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DrillRequest(String fingerprint, List<String> path, DrillAction action, DrillAxis axis) {

    public DrillRequest {
        Objects.requireNonNull(fingerprint, "fingerprint is required");
        Objects.requireNonNull(path, "path is required");
        Objects.requireNonNull(action, "action is required");
        path = PivotRequest.copyPath(path);
        if (axis == null) {
            axis = DrillAxis.ROWS;
        }
    }
}
