package org.pivotgrid.pivot.service;

import com.typesafe.config.Config;

import java.time.Duration;

/**
 * Engine-wide ceilings.
 *
 * @param maxRowsPerQuery    maximum rows any single query may return
 * @param maxColumnsPerQuery maximum columns a rendered pivot may have
 * @param queryTimeout       bound on one pivot computation and on each statement
 */
public record PivotLimits(int maxRowsPerQuery, int maxColumnsPerQuery, Duration queryTimeout) {

    public static final PivotLimits DEFAULTS = new PivotLimits(100_000, 1_000, Duration.ofSeconds(30));

    public PivotLimits {
        if (maxRowsPerQuery <= 0 || maxColumnsPerQuery <= 0) {
            throw new IllegalArgumentException("Row and column ceilings must be positive");
        }
        if (queryTimeout.isNegative() || queryTimeout.isZero()) {
            throw new IllegalArgumentException("Query timeout must be positive, got " + queryTimeout);
        }
    }

    /**
     * Reads a {@code limits} block, falling back to {@link #DEFAULTS} for missing keys.
     */
    public static PivotLimits fromConfig(final Config limits) {
        return new PivotLimits(
            limits.hasPath("maxRowsPerQuery") ? limits.getInt("maxRowsPerQuery") : DEFAULTS.maxRowsPerQuery(),
            limits.hasPath("maxColumnsPerQuery") ? limits.getInt("maxColumnsPerQuery") : DEFAULTS.maxColumnsPerQuery(),
            limits.hasPath("queryTimeoutSeconds")
                ? Duration.ofSeconds(limits.getInt("queryTimeoutSeconds"))
                : DEFAULTS.queryTimeout());
    }
}
