package org.pivotgrid.pivot.engine;

import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the pooled JDBC data source the engine and the catalog share.
 *
 * <h3>Configuration:</h3>
 * <pre>
 * database {
 *   jdbcUrl = "jdbc:h2:mem:pivotgrid;DB_CLOSE_DELAY=-1"
 *   username = "sa"
 *   password = ""
 *   driverClassName = "org.h2.Driver"   # optional
 *   maxPoolSize = 10
 *   minIdle = 2
 * }
 * </pre>
 */
public final class DataSources {

    private static final Logger LOGGER = LoggerFactory.getLogger(DataSources.class);

    private DataSources() {
        // utility class
    }

    public static HikariDataSource create(final String poolName, final Config database) {
        if (!database.hasPath("jdbcUrl")) {
            throw new IllegalArgumentException("'jdbcUrl' must be configured for pool '" + poolName + "'.");
        }
        final String jdbcUrl = database.getString("jdbcUrl");

        final HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        if (database.hasPath("driverClassName")) {
            hikariConfig.setDriverClassName(database.getString("driverClassName"));
        }
        hikariConfig.setUsername(database.hasPath("username") ? database.getString("username") : "sa");
        hikariConfig.setPassword(database.hasPath("password") ? database.getString("password") : "");
        hikariConfig.setMaximumPoolSize(database.hasPath("maxPoolSize") ? database.getInt("maxPoolSize") : 10);
        hikariConfig.setMinimumIdle(database.hasPath("minIdle") ? database.getInt("minIdle") : 2);
        hikariConfig.setReadOnly(database.hasPath("readOnly") && database.getBoolean("readOnly"));
        hikariConfig.setPoolName(poolName);

        try {
            final HikariDataSource dataSource = new HikariDataSource(hikariConfig);
            LOGGER.debug("Connection pool '{}' started (max={}, minIdle={})",
                poolName, hikariConfig.getMaximumPoolSize(), hikariConfig.getMinimumIdle());
            return dataSource;
        } catch (final RuntimeException e) {
            Throwable cause = e;
            while (cause.getCause() != null && cause.getCause() != cause) {
                cause = cause.getCause();
            }
            final String message = String.format("Failed to open connection pool '%s' for %s: %s",
                poolName, jdbcUrl, cause.getMessage());
            LOGGER.error(message);
            throw new IllegalStateException(message, e);
        }
    }
}
