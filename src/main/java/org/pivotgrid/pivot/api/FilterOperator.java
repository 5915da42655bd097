package org.pivotgrid.pivot.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The closed set of filter operators. Names outside this set fail request parsing.
 */
public enum FilterOperator {
    EQUALS("equals"),
    NOT_EQUALS("notEquals"),
    CONTAINS("contains"),
    NOT_CONTAINS("notContains"),
    GREATER_THAN("greaterThan"),
    LESS_THAN("lessThan"),
    GREATER_THAN_OR_EQUAL("greaterThanOrEqual"),
    LESS_THAN_OR_EQUAL("lessThanOrEqual"),
    IN("in"),
    NOT_IN("notIn"),
    BETWEEN("between"),
    IS_EMPTY("isEmpty"),
    IS_NOT_EMPTY("isNotEmpty");

    private final String wireName;

    FilterOperator(final String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * @return true if the operator ignores the filter value entirely
     */
    public boolean isNullary() {
        return this == IS_EMPTY || this == IS_NOT_EMPTY;
    }

    @JsonCreator
    public static FilterOperator fromWireName(final String name) {
        for (final FilterOperator op : values()) {
            if (op.wireName.equals(name)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown filter operator: " + name);
    }
}
