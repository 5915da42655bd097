package org.pivotgrid.pivot.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which header axis a drill applies to.
 */
public enum DrillAxis {
    ROWS("rows"),
    COLUMNS("columns");

    private final String wireName;

    DrillAxis(final String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static DrillAxis fromWireName(final String name) {
        for (final DrillAxis axis : values()) {
            if (axis.wireName.equals(name)) {
                return axis;
            }
        }
        throw new IllegalArgumentException("Unknown drill axis: " + name);
    }
}
