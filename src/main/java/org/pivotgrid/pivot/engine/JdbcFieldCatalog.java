package org.pivotgrid.pivot.engine;

import org.pivotgrid.pivot.api.DataType;
import org.pivotgrid.pivot.api.DatasetSchema;
import org.pivotgrid.pivot.api.Field;
import org.pivotgrid.pivot.api.IFieldCatalog;
import org.pivotgrid.pivot.api.PivotException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Field catalog backed by JDBC {@link DatabaseMetaData}. A dataset id names a table or view;
 * an exact name match wins over a case-insensitive one. Descriptions are cached until
 * {@link #invalidate()} is called.
 */
public class JdbcFieldCatalog implements IFieldCatalog {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcFieldCatalog.class);

    private final DataSource dataSource;
    private final String schema;
    private final Map<String, DatasetSchema> cache = new ConcurrentHashMap<>();

    /**
     * @param dataSource pooled connections to the engine
     * @param schema     schema to look tables up in, or {@code null} for all schemas
     */
    public JdbcFieldCatalog(final DataSource dataSource, final String schema) {
        this.dataSource = dataSource;
        this.schema = schema;
    }

    @Override
    public DatasetSchema describe(final String dataset) {
        return cache.computeIfAbsent(dataset, this::load);
    }

    /**
     * Drops all cached descriptions, e.g. after a table was altered.
     */
    public void invalidate() {
        cache.clear();
    }

    private DatasetSchema load(final String dataset) {
        if (dataset == null || dataset.isBlank()) {
            throw PivotException.unknownDataset(String.valueOf(dataset));
        }
        try (Connection conn = dataSource.getConnection()) {
            final DatabaseMetaData meta = conn.getMetaData();
            final TableRef table = findTable(meta, dataset);
            if (table == null) {
                throw PivotException.unknownDataset(dataset);
            }

            final List<Field> fields = new ArrayList<>();
            try (ResultSet rs = meta.getColumns(table.catalog, table.schema, table.name, null)) {
                while (rs.next()) {
                    // the table name is a LIKE pattern; '_' may have matched a neighbour
                    if (!table.name.equals(rs.getString("TABLE_NAME"))) {
                        continue;
                    }
                    final String column = rs.getString("COLUMN_NAME");
                    fields.add(Field.of(column, mapType(rs.getString("TYPE_NAME"))));
                }
            }
            LOGGER.debug("Described dataset '{}' as {}.{} with {} field(s)", dataset, table.schema, table.name, fields.size());
            return new DatasetSchema(dataset, table.schema, table.name, fields);
        } catch (final SQLException e) {
            throw PivotException.executionFailed("Failed to describe dataset '" + dataset + "': " + e.getMessage(), e);
        }
    }

    private TableRef findTable(final DatabaseMetaData meta, final String dataset) throws SQLException {
        TableRef caseInsensitive = null;
        try (ResultSet rs = meta.getTables(null, schema, null, null)) {
            while (rs.next()) {
                final String name = rs.getString("TABLE_NAME");
                final TableRef ref = new TableRef(rs.getString("TABLE_CAT"), rs.getString("TABLE_SCHEM"), name);
                if (name.equals(dataset)) {
                    return ref;
                }
                if (caseInsensitive == null && name.equalsIgnoreCase(dataset)) {
                    caseInsensitive = ref;
                }
            }
        }
        return caseInsensitive;
    }

    /**
     * Maps an engine type name to one of the four logical data types.
     */
    static DataType mapType(final String typeName) {
        if (typeName == null) {
            return DataType.STRING;
        }
        final String type = typeName.toUpperCase(Locale.ROOT);
        if (type.contains("INTERVAL")) {
            return DataType.STRING;
        }
        if (type.contains("INT") || type.contains("NUMERIC") || type.contains("DECIMAL")
            || type.contains("DOUBLE") || type.contains("REAL") || type.contains("FLOAT")
            || type.contains("DECFLOAT")) {
            return DataType.NUMBER;
        }
        if (type.contains("DATE") || type.contains("TIME")) {
            return DataType.DATE;
        }
        if (type.contains("BOOL")) {
            return DataType.BOOLEAN;
        }
        return DataType.STRING;
    }

    private static final class TableRef {
        final String catalog;
        final String schema;
        final String name;

        TableRef(final String catalog, final String schema, final String name) {
            this.catalog = catalog;
            this.schema = schema;
            this.name = name;
        }
    }
}
