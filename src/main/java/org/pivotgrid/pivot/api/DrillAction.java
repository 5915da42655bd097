package org.pivotgrid.pivot.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DrillAction {
    EXPAND("expand"),
    COLLAPSE("collapse");

    private final String wireName;

    DrillAction(final String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static DrillAction fromWireName(final String name) {
        for (final DrillAction action : values()) {
            if (action.wireName.equals(name)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown drill action: " + name);
    }
}
