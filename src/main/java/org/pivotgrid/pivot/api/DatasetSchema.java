package org.pivotgrid.pivot.api;

import java.util.List;
import java.util.Optional;

/**
 * Catalog description of a dataset.
 *
 * @param dataset the dataset id as requested
 * @param schema  the database schema holding the table, or {@code null} for the connection default
 * @param table   the physical table name the dataset resolves to
 * @param fields  ordered fields
 */
public record DatasetSchema(String dataset, String schema, String table, List<Field> fields) {

    public DatasetSchema {
        fields = List.copyOf(fields);
    }

    public Optional<Field> field(final String id) {
        return fields.stream().filter(f -> f.id().equals(id)).findFirst();
    }
}
