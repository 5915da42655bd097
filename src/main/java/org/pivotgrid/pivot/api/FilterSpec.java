package org.pivotgrid.pivot.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * A single filter predicate as submitted by the caller. {@code value} is kept as raw JSON and
 * only coerced to typed values once the field's data type is known.
 *
 * @param field    the filtered field
 * @param operator the comparison operator
 * @param value    a scalar, a list, or an object {@code {min, max}}; ignored by nullary operators
 * @param enabled  whether the filter applies; {@code null} means enabled
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FilterSpec(Field field, FilterOperator operator, JsonNode value, Boolean enabled) {

    public FilterSpec {
        Objects.requireNonNull(field, "filter requires a field");
        Objects.requireNonNull(operator, "filter requires an operator");
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
    }
}
