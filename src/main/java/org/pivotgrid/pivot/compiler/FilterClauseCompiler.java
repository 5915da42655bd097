package org.pivotgrid.pivot.compiler;

import org.pivotgrid.pivot.api.DataType;
import org.pivotgrid.pivot.api.PivotValue;

import java.util.Collections;

/**
 * Compiles one resolved filter into a parenthesized, parameterized predicate.
 * No filter value is ever inlined into the SQL text.
 */
public final class FilterClauseCompiler {

    private static final String LIKE_ESCAPE = "\\";

    public SqlFragment compile(final ResolvedFilter filter) {
        final String column = SqlIdentifiers.quote(filter.field().id());
        final boolean isString = filter.field().dataType() == DataType.STRING;
        final FilterArgument arg = filter.argument();

        switch (filter.operator()) {
            case EQUALS:
                return SqlFragment.of("(" + column + " = ?)", arg.first());
            case NOT_EQUALS:
                return SqlFragment.of("(" + column + " <> ?)", arg.first());
            case CONTAINS:
                return like(column, isString, false, arg.first());
            case NOT_CONTAINS:
                return like(column, isString, true, arg.first());
            case GREATER_THAN:
                return SqlFragment.of("(" + column + " > ?)", arg.first());
            case LESS_THAN:
                return SqlFragment.of("(" + column + " < ?)", arg.first());
            case GREATER_THAN_OR_EQUAL:
                return SqlFragment.of("(" + column + " >= ?)", arg.first());
            case LESS_THAN_OR_EQUAL:
                return SqlFragment.of("(" + column + " <= ?)", arg.first());
            case IN:
                return membership(column, false, arg);
            case NOT_IN:
                return membership(column, true, arg);
            case BETWEEN:
                return new SqlFragment("(" + column + " BETWEEN ? AND ?)", arg.values());
            case IS_EMPTY:
                return SqlFragment.of(isString
                    ? "(" + column + " IS NULL OR " + column + " = '')"
                    : "(" + column + " IS NULL)");
            case IS_NOT_EMPTY:
                return SqlFragment.of(isString
                    ? "(" + column + " IS NOT NULL AND " + column + " <> '')"
                    : "(" + column + " IS NOT NULL)");
            default:
                throw new IllegalStateException("Unhandled operator " + filter.operator());
        }
    }

    private SqlFragment like(final String column, final boolean isString, final boolean negate, final PivotValue needle) {
        final String target = isString ? column : "CAST(" + column + " AS VARCHAR)";
        final String pattern = "%" + escapeLike(needle.toPathElement()) + "%";
        return SqlFragment.of(
            "(" + target + (negate ? " NOT LIKE" : " LIKE") + " ? ESCAPE '" + LIKE_ESCAPE + "')",
            PivotValue.ofString(pattern));
    }

    private SqlFragment membership(final String column, final boolean negate, final FilterArgument arg) {
        if (arg.values().isEmpty()) {
            // x IN () is not valid SQL; an empty set matches nothing, its negation everything
            return SqlFragment.of(negate ? "(1 = 1)" : "(1 = 0)");
        }
        final String placeholders = String.join(", ", Collections.nCopies(arg.values().size(), "?"));
        return new SqlFragment(
            "(" + column + (negate ? " NOT IN (" : " IN (") + placeholders + "))",
            arg.values());
    }

    static String escapeLike(final String text) {
        return text
            .replace(LIKE_ESCAPE, LIKE_ESCAPE + LIKE_ESCAPE)
            .replace("%", LIKE_ESCAPE + "%")
            .replace("_", LIKE_ESCAPE + "_");
    }
}
