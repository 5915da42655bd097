package org.pivotgrid.pivot.service;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pivotgrid.pivot.api.DrillAction;
import org.pivotgrid.pivot.api.DrillAxis;
import org.pivotgrid.pivot.api.DrillRequest;
import org.pivotgrid.pivot.api.PivotRequest;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pivotgrid.pivot.PivotFixtures.PRODUCT;
import static org.pivotgrid.pivot.PivotFixtures.QUARTER;
import static org.pivotgrid.pivot.PivotFixtures.REGION;
import static org.pivotgrid.pivot.PivotFixtures.REVENUE;
import static org.pivotgrid.pivot.PivotFixtures.config;
import static org.pivotgrid.pivot.PivotFixtures.sum;

@Tag("unit")
class DrillCoordinatorTest {

    private final PivotRequest source = new PivotRequest("sales",
        config(List.of(REGION, PRODUCT), List.of(QUARTER), List.of(sum(REVENUE))),
        Set.of(List.of("EU")), Set.of());

    @Test
    void expandAddsRowPathAndLeavesSourceUntouched() {
        final PivotRequest derived = DrillCoordinator.derive(source,
            new DrillRequest("fp", List.of("US"), DrillAction.EXPAND, null));

        assertThat(derived.expandedPaths()).containsExactlyInAnyOrder(List.of("EU"), List.of("US"));
        assertThat(derived.configuration()).isEqualTo(source.configuration());
        assertThat(source.expandedPaths()).containsExactly(List.of("EU"));
    }

    @Test
    void collapseRemovesOnlyTheGivenPath() {
        final PivotRequest derived = DrillCoordinator.derive(source,
            new DrillRequest("fp", List.of("EU"), DrillAction.COLLAPSE, DrillAxis.ROWS));

        assertThat(derived.expandedPaths()).isEmpty();
    }

    @Test
    void repeatedDrillsAreIdempotent() {
        final PivotRequest expandedAgain = DrillCoordinator.derive(source,
            new DrillRequest("fp", List.of("EU"), DrillAction.EXPAND, DrillAxis.ROWS));
        final PivotRequest collapsedTwice = DrillCoordinator.derive(source,
            new DrillRequest("fp", List.of("US"), DrillAction.COLLAPSE, DrillAxis.ROWS));

        assertThat(expandedAgain).isEqualTo(source);
        assertThat(collapsedTwice).isEqualTo(source);
    }

    @Test
    void columnAxisTouchesColumnPathsOnly() {
        final PivotRequest derived = DrillCoordinator.derive(source,
            new DrillRequest("fp", List.of("Q1"), DrillAction.EXPAND, DrillAxis.COLUMNS));

        assertThat(derived.expandedColumnPaths()).containsExactly(List.of("Q1"));
        assertThat(derived.expandedPaths()).isEqualTo(source.expandedPaths());
    }

    @Test
    void nullGroupKeysCanBeDrilled() {
        final List<String> nullPath = Arrays.asList((String) null);
        final PivotRequest derived = DrillCoordinator.derive(source,
            new DrillRequest("fp", nullPath, DrillAction.EXPAND, DrillAxis.ROWS));

        assertThat(derived.expandedPaths()).contains(nullPath);
    }
}
