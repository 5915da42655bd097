package org.pivotgrid.pivot.engine;

import org.pivotgrid.pivot.api.CompiledQuery;
import org.pivotgrid.pivot.api.IQueryEngine;
import org.pivotgrid.pivot.api.PivotException;
import org.pivotgrid.pivot.api.PivotValue;
import org.pivotgrid.pivot.api.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs compiled queries through JDBC. Every parameter is bound through the prepared statement;
 * statements carry the configured query timeout.
 */
public class JdbcQueryEngine implements IQueryEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcQueryEngine.class);

    private final DataSource dataSource;
    private final int queryTimeoutSeconds;

    /**
     * @param dataSource          pooled connections to the engine
     * @param queryTimeoutSeconds statement timeout, 0 for none
     */
    public JdbcQueryEngine(final DataSource dataSource, final int queryTimeoutSeconds) {
        this.dataSource = dataSource;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    @Override
    public QueryResult execute(final CompiledQuery query) {
        final long start = System.nanoTime();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(query.sql())) {
            if (queryTimeoutSeconds > 0) {
                stmt.setQueryTimeout(queryTimeoutSeconds);
            }
            bind(stmt, query.parameters());

            try (ResultSet rs = stmt.executeQuery()) {
                final ResultSetMetaData meta = rs.getMetaData();
                final int width = meta.getColumnCount();
                final List<String> columns = new ArrayList<>(width);
                for (int i = 1; i <= width; i++) {
                    columns.add(meta.getColumnLabel(i));
                }

                final List<List<PivotValue>> rows = new ArrayList<>();
                while (rs.next()) {
                    final List<PivotValue> row = new ArrayList<>(width);
                    for (int i = 1; i <= width; i++) {
                        row.add(PivotValue.fromJdbc(rs.getObject(i)));
                    }
                    rows.add(row);
                }

                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Query returned {} row(s) in {} ms: {}",
                        rows.size(), (System.nanoTime() - start) / 1_000_000, query.sql());
                }
                return new QueryResult(columns, rows);
            }
        } catch (final SQLException e) {
            LOGGER.warn("Query failed ({}): {}", e.getSQLState(), e.getMessage());
            throw PivotException.executionFailed("Query execution failed: " + e.getMessage(), e);
        }
    }

    private static void bind(final PreparedStatement stmt, final List<PivotValue> parameters) throws SQLException {
        for (int i = 0; i < parameters.size(); i++) {
            final PivotValue value = parameters.get(i);
            final int index = i + 1;
            switch (value.kind()) {
                case NULL -> stmt.setNull(index, Types.NULL);
                case NUMBER -> stmt.setBigDecimal(index, value.asNumber());
                case BOOLEAN -> stmt.setBoolean(index, (Boolean) value.toJdbcValue());
                case DATE -> stmt.setObject(index, value.asTemporal());
                case STRING -> stmt.setString(index, (String) value.toJdbcValue());
            }
        }
    }
}
