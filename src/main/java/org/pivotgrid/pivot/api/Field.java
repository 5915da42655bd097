package org.pivotgrid.pivot.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A dataset column as seen by the pivot. Identity is the case-sensitive {@code id}; the catalog
 * copy of a field is authoritative for {@code name} and {@code dataType}.
 *
 * @param id       column name in the dataset
 * @param name     display name
 * @param dataType logical type
 * @param format   optional display format pattern
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Field(String id, String name, DataType dataType, String format) {

    public static Field of(final String id, final DataType dataType) {
        return new Field(id, displayNameOf(id), dataType, null);
    }

    /**
     * Returns a copy of this field carrying the given display format.
     */
    public Field withFormat(final String newFormat) {
        return new Field(id, name, dataType, newFormat);
    }

    /**
     * Derives a display name from a column id: underscores become spaces and each word is
     * title-cased, e.g. {@code order_date -> Order Date}.
     */
    public static String displayNameOf(final String id) {
        final StringBuilder sb = new StringBuilder(id.length());
        boolean startOfWord = true;
        for (final char c : id.replace('_', ' ').toCharArray()) {
            if (Character.isLetter(c)) {
                sb.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                sb.append(c);
                startOfWord = true;
            }
        }
        return sb.toString();
    }
}
