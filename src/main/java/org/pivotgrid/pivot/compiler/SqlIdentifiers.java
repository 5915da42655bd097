package org.pivotgrid.pivot.compiler;

/**
 * Identifier quoting shared by all SQL produced by the compiler.
 */
public final class SqlIdentifiers {

    private SqlIdentifiers() {
        // utility class
    }

    /**
     * Quotes an identifier with double quotes, doubling embedded quotes.
     *
     * @param identifier a table, column or alias name
     * @return the quoted identifier
     */
    public static String quote(final String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Quotes a possibly schema-qualified table name.
     */
    public static String table(final String schema, final String table) {
        return schema == null ? quote(table) : quote(schema) + "." + quote(table);
    }
}
