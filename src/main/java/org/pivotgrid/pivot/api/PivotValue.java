package org.pivotgrid.pivot.api;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.temporal.Temporal;
import java.util.Comparator;
import java.util.Objects;

/**
 * An immutable typed scalar used for filter parameters, group keys and cell values.
 * Numbers are held as {@link BigDecimal}, dates as {@code java.time} values.
 */
public final class PivotValue {

    public enum Kind { STRING, NUMBER, DATE, BOOLEAN, NULL }

    /** Label rendered for a group whose key is SQL NULL. */
    public static final String NULL_LABEL = "(null)";

    public static final PivotValue NULL = new PivotValue(Kind.NULL, null);

    /**
     * Ascending order of group keys with NULL last, matching {@code ORDER BY ... ASC NULLS LAST}
     * under binary collation.
     */
    public static final Comparator<PivotValue> KEY_ORDER = PivotValue::compareKeys;

    private final Kind kind;
    private final Object value;

    private PivotValue(final Kind kind, final Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static PivotValue ofString(final String s) {
        return s == null ? NULL : new PivotValue(Kind.STRING, s);
    }

    public static PivotValue ofNumber(final BigDecimal n) {
        return n == null ? NULL : new PivotValue(Kind.NUMBER, n);
    }

    public static PivotValue ofNumber(final long n) {
        return new PivotValue(Kind.NUMBER, BigDecimal.valueOf(n));
    }

    public static PivotValue ofDate(final Temporal t) {
        return t == null ? NULL : new PivotValue(Kind.DATE, t);
    }

    public static PivotValue ofBoolean(final boolean b) {
        return new PivotValue(Kind.BOOLEAN, b);
    }

    /**
     * Converts a value read through JDBC {@code getObject}.
     */
    public static PivotValue fromJdbc(final Object raw) {
        if (raw == null) {
            return NULL;
        }
        if (raw instanceof BigDecimal) {
            return ofNumber((BigDecimal) raw);
        }
        if (raw instanceof BigInteger) {
            return ofNumber(new BigDecimal((BigInteger) raw));
        }
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return ofNumber(((Number) raw).longValue());
        }
        if (raw instanceof Double || raw instanceof Float) {
            final double d = ((Number) raw).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return ofString(Double.toString(d));
            }
            return ofNumber(BigDecimal.valueOf(d));
        }
        if (raw instanceof Boolean) {
            return ofBoolean((Boolean) raw);
        }
        if (raw instanceof java.sql.Date) {
            return ofDate(((java.sql.Date) raw).toLocalDate());
        }
        if (raw instanceof Timestamp) {
            return ofDate(((Timestamp) raw).toLocalDateTime());
        }
        if (raw instanceof Time) {
            return ofDate(((Time) raw).toLocalTime());
        }
        if (raw instanceof LocalDate || raw instanceof LocalDateTime
            || raw instanceof LocalTime || raw instanceof OffsetDateTime) {
            return ofDate((Temporal) raw);
        }
        return ofString(raw.toString());
    }

    public Kind kind() {
        return kind;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public BigDecimal asNumber() {
        if (kind != Kind.NUMBER) {
            throw new IllegalStateException("Not a number: " + this);
        }
        return (BigDecimal) value;
    }

    public Temporal asTemporal() {
        if (kind != Kind.DATE) {
            throw new IllegalStateException("Not a date: " + this);
        }
        return (Temporal) value;
    }

    /**
     * @return the value to bind as a JDBC statement parameter
     */
    public Object toJdbcValue() {
        return value;
    }

    /**
     * JSON form: the raw scalar, dates as ISO-8601 strings.
     */
    @JsonValue
    public Object toJson() {
        return kind == Kind.DATE ? value.toString() : value;
    }

    /**
     * Canonical text used as a hierarchy path element; {@code null} for a NULL key.
     */
    public String toPathElement() {
        switch (kind) {
            case NULL:
                return null;
            case NUMBER:
                return plain((BigDecimal) value);
            default:
                return value.toString();
        }
    }

    /**
     * Header label for a group key.
     */
    public String toLabel() {
        return kind == Kind.NULL ? NULL_LABEL : toPathElement();
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compareKeys(final PivotValue a, final PivotValue b) {
        if (a.kind != b.kind) {
            if (a.kind == Kind.NULL || b.kind == Kind.NULL) {
                return a.kind == Kind.NULL ? 1 : -1;
            }
            return Integer.compare(a.kind.ordinal(), b.kind.ordinal());
        }
        switch (a.kind) {
            case NULL:
                return 0;
            case NUMBER:
                return ((BigDecimal) a.value).compareTo((BigDecimal) b.value);
            case DATE:
                if (a.value.getClass() == b.value.getClass() && a.value instanceof Comparable) {
                    return ((Comparable) a.value).compareTo(b.value);
                }
                return a.value.toString().compareTo(b.value.toString());
            case BOOLEAN:
                return Boolean.compare((Boolean) a.value, (Boolean) b.value);
            default:
                return ((String) a.value).compareTo((String) b.value);
        }
    }

    private static String plain(final BigDecimal n) {
        return n.signum() == 0 ? "0" : n.stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PivotValue)) {
            return false;
        }
        final PivotValue other = (PivotValue) o;
        if (kind != other.kind) {
            return false;
        }
        if (kind == Kind.NUMBER) {
            return ((BigDecimal) value).compareTo((BigDecimal) other.value) == 0;
        }
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, kind == Kind.NUMBER ? plain((BigDecimal) value) : value);
    }

    @Override
    public String toString() {
        return kind + "(" + value + ")";
    }
}
