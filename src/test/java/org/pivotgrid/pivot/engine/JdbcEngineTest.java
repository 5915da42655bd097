package org.pivotgrid.pivot.engine;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.pivotgrid.junit.extensions.logging.ExpectLog;
import org.pivotgrid.junit.extensions.logging.LogLevel;
import org.pivotgrid.junit.extensions.logging.LogWatchExtension;
import org.pivotgrid.pivot.api.CompiledQuery;
import org.pivotgrid.pivot.api.DataType;
import org.pivotgrid.pivot.api.DatasetSchema;
import org.pivotgrid.pivot.api.Field;
import org.pivotgrid.pivot.api.PivotErrorKind;
import org.pivotgrid.pivot.api.PivotException;
import org.pivotgrid.pivot.api.PivotValue;
import org.pivotgrid.pivot.api.QueryResult;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import javax.sql.DataSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Catalog and query engine against an in-memory H2 database.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class JdbcEngineTest {

    private JdbcDataSource dataSource;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:engine-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE \"orders\" (\"id\" INT PRIMARY KEY, \"region\" VARCHAR(20),"
                + " \"amount\" DECIMAL(10,2), \"placed\" DATE, \"paid\" BOOLEAN)");
            stmt.execute("INSERT INTO \"orders\" VALUES"
                + " (1, 'US', 10.50, DATE '2024-01-15', TRUE),"
                + " (2, 'US', 4.50, DATE '2024-02-01', FALSE),"
                + " (3, 'EU', 7.00, DATE '2024-01-20', TRUE),"
                + " (4, NULL, 1.00, NULL, NULL)");
        }
    }

    @Test
    void describesTableColumnsInOrderWithLogicalTypes() {
        final DatasetSchema schema = new JdbcFieldCatalog(dataSource, "PUBLIC").describe("orders");

        assertThat(schema.table()).isEqualTo("orders");
        assertThat(schema.schema()).isEqualTo("PUBLIC");
        assertThat(schema.fields()).extracting(Field::id).containsExactly("id", "region", "amount", "placed", "paid");
        assertThat(schema.fields()).extracting(Field::dataType).containsExactly(
            DataType.NUMBER, DataType.STRING, DataType.NUMBER, DataType.DATE, DataType.BOOLEAN);
    }

    @Test
    void datasetNamesMatchCaseInsensitivelyAsFallback() {
        final DatasetSchema schema = new JdbcFieldCatalog(dataSource, "PUBLIC").describe("ORDERS");

        assertThat(schema.dataset()).isEqualTo("ORDERS");
        assertThat(schema.table()).isEqualTo("orders");
    }

    @Test
    void unknownDatasetIsReported() {
        final JdbcFieldCatalog catalog = new JdbcFieldCatalog(dataSource, "PUBLIC");

        assertThatThrownBy(() -> catalog.describe("invoices"))
            .isInstanceOf(PivotException.class)
            .satisfies(e -> assertThat(((PivotException) e).getKind()).isEqualTo(PivotErrorKind.UNKNOWN_DATASET));
    }

    @Test
    void descriptionsAreCachedUntilInvalidated() throws SQLException {
        final JdbcFieldCatalog catalog = new JdbcFieldCatalog(dataSource, "PUBLIC");
        assertThat(catalog.describe("orders").fields()).hasSize(5);

        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("ALTER TABLE \"orders\" ADD COLUMN \"note\" VARCHAR(50)");
        }
        assertThat(catalog.describe("orders").fields()).hasSize(5);

        catalog.invalidate();
        assertThat(catalog.describe("orders").fields()).hasSize(6);
    }

    @Test
    void concurrentDescribesLoadTheSchemaOnce() throws Exception {
        final DataSource counted = mock(DataSource.class);
        when(counted.getConnection()).thenAnswer(invocation -> dataSource.getConnection());
        final JdbcFieldCatalog catalog = new JdbcFieldCatalog(counted, "PUBLIC");
        final ExecutorService pool = Executors.newFixedThreadPool(4);
        final CountDownLatch go = new CountDownLatch(1);
        try {
            final List<Future<DatasetSchema>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    return catalog.describe("orders");
                }));
            }
            go.countDown();
            final DatasetSchema first = futures.get(0).get(10, TimeUnit.SECONDS);
            for (final Future<DatasetSchema> future : futures) {
                assertThat(future.get(10, TimeUnit.SECONDS)).isSameAs(first);
            }
        } finally {
            pool.shutdownNow();
        }

        verify(counted, times(1)).getConnection();
    }

    @Test
    void mapsEngineTypeNames() {
        assertThat(JdbcFieldCatalog.mapType("BIGINT")).isEqualTo(DataType.NUMBER);
        assertThat(JdbcFieldCatalog.mapType("DOUBLE PRECISION")).isEqualTo(DataType.NUMBER);
        assertThat(JdbcFieldCatalog.mapType("NUMERIC")).isEqualTo(DataType.NUMBER);
        assertThat(JdbcFieldCatalog.mapType("TIMESTAMP WITH TIME ZONE")).isEqualTo(DataType.DATE);
        assertThat(JdbcFieldCatalog.mapType("INTERVAL DAY")).isEqualTo(DataType.STRING);
        assertThat(JdbcFieldCatalog.mapType("BOOLEAN")).isEqualTo(DataType.BOOLEAN);
        assertThat(JdbcFieldCatalog.mapType("CHARACTER VARYING")).isEqualTo(DataType.STRING);
        assertThat(JdbcFieldCatalog.mapType(null)).isEqualTo(DataType.STRING);
    }

    @Test
    void executesParameterizedQueryWithTypedValues() {
        final JdbcQueryEngine engine = new JdbcQueryEngine(dataSource, 5);

        final QueryResult result = engine.execute(new CompiledQuery(
            "SELECT \"region\", SUM(\"amount\") AS \"Total\", MIN(\"placed\") AS \"First\", BOOL_AND(\"paid\") AS \"Paid\""
                + " FROM \"orders\" WHERE \"amount\" > ? GROUP BY \"region\" ORDER BY 1 ASC NULLS LAST",
            List.of(PivotValue.ofNumber(2))));

        assertThat(result.columns()).containsExactly("region", "Total", "First", "Paid");
        assertThat(result.rows()).containsExactly(
            List.of(PivotValue.ofString("EU"), PivotValue.ofNumber(new BigDecimal("7")),
                PivotValue.ofDate(LocalDate.of(2024, 1, 20)), PivotValue.ofBoolean(true)),
            List.of(PivotValue.ofString("US"), PivotValue.ofNumber(new BigDecimal("15.00")),
                PivotValue.ofDate(LocalDate.of(2024, 1, 15)), PivotValue.ofBoolean(false)));
    }

    @Test
    void nullColumnsBecomeNullValues() {
        final QueryResult result = new JdbcQueryEngine(dataSource, 0).execute(new CompiledQuery(
            "SELECT \"region\", \"placed\" FROM \"orders\" WHERE \"id\" = ?", List.of(PivotValue.ofNumber(4))));

        assertThat(result.rows()).containsExactly(List.of(PivotValue.NULL, PivotValue.NULL));
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*JdbcQueryEngine", messagePattern = "(?s)Query failed.*")
    void engineErrorsAreExecutionFailures() {
        final JdbcQueryEngine engine = new JdbcQueryEngine(dataSource, 5);

        assertThatThrownBy(() -> engine.execute(new CompiledQuery("SELECT \"nope\" FROM \"orders\"", List.of())))
            .isInstanceOf(PivotException.class)
            .satisfies(e -> assertThat(((PivotException) e).getKind()).isEqualTo(PivotErrorKind.QUERY_EXECUTION_FAILED))
            .hasCauseInstanceOf(SQLException.class);
    }
}
