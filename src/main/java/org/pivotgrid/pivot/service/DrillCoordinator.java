package org.pivotgrid.pivot.service;

import org.pivotgrid.pivot.api.DrillAction;
import org.pivotgrid.pivot.api.DrillAxis;
import org.pivotgrid.pivot.api.DrillRequest;
import org.pivotgrid.pivot.api.PivotRequest;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Derives the follow-up request of a drill. The source request is never modified; expanding an
 * expanded path or collapsing a collapsed one yields an equal request.
 */
public final class DrillCoordinator {

    private DrillCoordinator() {
        // utility class
    }

    public static PivotRequest derive(final PivotRequest source, final DrillRequest drill) {
        final boolean rows = drill.axis() == DrillAxis.ROWS;
        final Set<List<String>> paths = new LinkedHashSet<>(rows ? source.expandedPaths() : source.expandedColumnPaths());
        final List<String> path = PivotRequest.copyPath(drill.path());
        if (drill.action() == DrillAction.EXPAND) {
            paths.add(path);
        } else {
            paths.remove(path);
        }
        return rows ? source.withExpandedPaths(paths) : source.withExpandedColumnPaths(paths);
    }
}
