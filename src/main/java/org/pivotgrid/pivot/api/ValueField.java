package org.pivotgrid.pivot.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A measure: a field paired with an aggregation.
 *
 * @param field       the aggregated field
 * @param aggregation the aggregation function
 * @param format      optional display format overriding the field's own
 * @param displayName optional label used for the measure header
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValueField(Field field, AggregationType aggregation, String format, String displayName) {

    public ValueField {
        Objects.requireNonNull(field, "value field requires a field");
        Objects.requireNonNull(aggregation, "value field requires an aggregation");
    }

    public static ValueField of(final Field field, final AggregationType aggregation) {
        return new ValueField(field, aggregation, null, null);
    }
}
