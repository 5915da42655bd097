package org.pivotgrid.pivot.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of a rendered cell or header slot. Ordered by precedence: when a row slot and a column
 * slot of different kinds intersect, the cell takes the higher one.
 */
public enum CellType {
    DATA("data"),
    SUBTOTAL("subtotal"),
    GRAND_TOTAL("grandTotal");

    private final String wireName;

    CellType(final String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public CellType max(final CellType other) {
        return other.ordinal() > ordinal() ? other : this;
    }

    @JsonCreator
    public static CellType fromWireName(final String name) {
        for (final CellType type : values()) {
            if (type.wireName.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown cell type: " + name);
    }
}
