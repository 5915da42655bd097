package org.pivotgrid.pivot.materializer;

import org.pivotgrid.pivot.api.DataType;
import org.pivotgrid.pivot.api.PivotValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.DateTimeException;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Renders cell values and header labels. Number patterns follow {@link DecimalFormat}, date
 * patterns {@link DateTimeFormatter}. Instances cache compiled patterns and are not thread-safe;
 * use one per materialization.
 */
public final class CellFormatter {

    private static final Logger LOGGER = LoggerFactory.getLogger(CellFormatter.class);

    private final Map<String, DecimalFormat> numberFormats = new HashMap<>();
    private final Map<String, DateTimeFormatter> dateFormats = new HashMap<>();

    /**
     * Checks that a pattern compiles for the given data type.
     *
     * @throws IllegalArgumentException if the pattern is invalid
     */
    public static void checkPattern(final String pattern, final DataType type) {
        switch (type) {
            case NUMBER -> numberFormat(pattern);
            case DATE -> DateTimeFormatter.ofPattern(pattern, Locale.ROOT);
            default -> {
                // strings and booleans are rendered verbatim
            }
        }
    }

    /**
     * @return the display text; empty for a missing value
     */
    public String format(final PivotValue value, final String pattern) {
        if (value.isNull()) {
            return "";
        }
        if (pattern != null) {
            if (value.kind() == PivotValue.Kind.NUMBER) {
                return numberFormats.computeIfAbsent(pattern, CellFormatter::numberFormat).format(value.asNumber());
            }
            if (value.kind() == PivotValue.Kind.DATE) {
                try {
                    return dateFormats.computeIfAbsent(pattern, p -> DateTimeFormatter.ofPattern(p, Locale.ROOT))
                        .format(value.asTemporal());
                } catch (final DateTimeException e) {
                    // e.g. an hour pattern applied to a plain date
                    LOGGER.debug("Pattern '{}' does not apply to {}: {}", pattern, value, e.getMessage());
                }
            }
        }
        return value.toPathElement();
    }

    /**
     * @return the header label of a group key
     */
    public String label(final PivotValue key, final String pattern) {
        return key.isNull() ? PivotValue.NULL_LABEL : format(key, pattern);
    }

    private static DecimalFormat numberFormat(final String pattern) {
        return new DecimalFormat(pattern, DecimalFormatSymbols.getInstance(Locale.ROOT));
    }
}
