package org.pivotgrid.pivot.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import org.pivotgrid.pivot.api.Field;
import org.pivotgrid.pivot.api.FilterOperator;
import org.pivotgrid.pivot.api.PivotException;
import org.pivotgrid.pivot.api.PivotValue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Coerces raw JSON filter values into typed {@link FilterArgument}s according to the operator's
 * expected shape and the field's data type.
 */
public final class FilterValues {

    private FilterValues() {
        // utility class
    }

    /**
     * @throws PivotException {@code InvalidFilterValue} on a shape or type mismatch
     */
    public static FilterArgument coerce(final Field field, final FilterOperator operator, final JsonNode value) {
        switch (operator) {
            case IS_EMPTY:
            case IS_NOT_EMPTY:
                return FilterArgument.none();
            case IN:
            case NOT_IN:
                return coerceList(field, operator, value);
            case BETWEEN:
                return coerceRange(field, value);
            case CONTAINS:
            case NOT_CONTAINS:
                return FilterArgument.single(PivotValue.ofString(text(field, operator, value)));
            default:
                return FilterArgument.single(coerceScalar(field, operator, value));
        }
    }

    private static FilterArgument coerceList(final Field field, final FilterOperator operator, final JsonNode value) {
        if (value == null || !value.isArray()) {
            throw PivotException.invalidFilterValue(
                "Operator '" + operator.wireName() + "' on field '" + field.id() + "' requires a list value");
        }
        final List<PivotValue> values = new ArrayList<>(value.size());
        for (final JsonNode element : value) {
            values.add(coerceScalar(field, operator, element));
        }
        return FilterArgument.list(values);
    }

    private static FilterArgument coerceRange(final Field field, final JsonNode value) {
        final JsonNode min;
        final JsonNode max;
        if (value != null && value.isObject()) {
            min = value.get("min");
            max = value.get("max");
        } else if (value != null && value.isArray() && value.size() == 2) {
            min = value.get(0);
            max = value.get(1);
        } else {
            throw PivotException.invalidFilterValue(
                "Operator 'between' on field '" + field.id() + "' requires a {min, max} value");
        }
        return FilterArgument.range(
            coerceScalar(field, FilterOperator.BETWEEN, min),
            coerceScalar(field, FilterOperator.BETWEEN, max));
    }

    private static String text(final Field field, final FilterOperator operator, final JsonNode value) {
        if (value == null || value.isNull() || !value.isValueNode()) {
            throw mismatch(field, operator, value, "a scalar");
        }
        return value.asText();
    }

    static PivotValue coerceScalar(final Field field, final FilterOperator operator, final JsonNode value) {
        if (value == null || value.isNull() || !value.isValueNode()) {
            throw mismatch(field, operator, value, "a scalar");
        }
        switch (field.dataType()) {
            case NUMBER:
                return PivotValue.ofNumber(number(field, operator, value));
            case DATE:
                if (!value.isTextual()) {
                    throw mismatch(field, operator, value, "an ISO-8601 date string");
                }
                return PivotValue.ofDate(temporal(field, operator, value));
            case BOOLEAN:
                return PivotValue.ofBoolean(bool(field, operator, value));
            case STRING:
            default:
                return PivotValue.ofString(value.asText());
        }
    }

    private static BigDecimal number(final Field field, final FilterOperator operator, final JsonNode value) {
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (value.isTextual()) {
            try {
                return new BigDecimal(value.textValue().trim());
            } catch (final NumberFormatException e) {
                throw mismatch(field, operator, value, "a number");
            }
        }
        throw mismatch(field, operator, value, "a number");
    }

    private static Temporal temporal(final Field field, final FilterOperator operator, final JsonNode value) {
        final String text = value.textValue().trim();
        try {
            if (text.indexOf('T') > 0 || text.indexOf(' ') > 0) {
                final String iso = text.replace(' ', 'T');
                if (hasOffset(iso)) {
                    return OffsetDateTime.parse(iso);
                }
                return LocalDateTime.parse(iso);
            }
            if (text.indexOf(':') > 0) {
                return LocalTime.parse(text);
            }
            return LocalDate.parse(text);
        } catch (final DateTimeParseException e) {
            throw mismatch(field, operator, value, "an ISO-8601 date string");
        }
    }

    private static boolean hasOffset(final String iso) {
        final String time = iso.substring(iso.indexOf('T') + 1);
        return time.endsWith("Z") || time.endsWith("z") || time.indexOf('+') >= 0 || time.indexOf('-') >= 0;
    }

    private static boolean bool(final Field field, final FilterOperator operator, final JsonNode value) {
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isTextual()) {
            final String text = value.textValue().trim().toLowerCase(Locale.ROOT);
            if ("true".equals(text) || "false".equals(text)) {
                return Boolean.parseBoolean(text);
            }
        }
        throw mismatch(field, operator, value, "a boolean");
    }

    private static PivotException mismatch(final Field field, final FilterOperator operator,
                                           final JsonNode value, final String expected) {
        return PivotException.invalidFilterValue(String.format(
            "Operator '%s' on field '%s' (%s) requires %s, got %s",
            operator.wireName(), field.id(), field.dataType().wireName(), expected, value));
    }
}
