package org.pivotgrid.pivot.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Logical data type of a dataset field. Drives filter value coercion and cell formatting.
 */
public enum DataType {
    STRING("string"),
    NUMBER("number"),
    DATE("date"),
    BOOLEAN("boolean");

    private final String wireName;

    DataType(final String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static DataType fromWireName(final String name) {
        if (name == null) {
            return null;
        }
        for (final DataType type : values()) {
            if (type.wireName.equals(name.toLowerCase(Locale.ROOT))) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown data type: " + name);
    }
}
