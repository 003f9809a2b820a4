package me.christianrobert.orapgroutines.integration;

import me.christianrobert.orapgroutines.config.service.ConfigService;
import me.christianrobert.orapgroutines.core.job.model.routine.PackageSource;
import me.christianrobert.orapgroutines.core.job.model.routine.PackageTranslationReport;
import me.christianrobert.orapgroutines.transformer.context.RoutineTranslationResult;
import me.christianrobert.orapgroutines.transformer.service.PackageTranslationService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.lang.reflect.Field;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Base class for tests that install translated routines into a real PostgreSQL.
 *
 * <p>The container is shared by all test methods of a class. Each test gets a fresh
 * connection; every non-system schema except {@code public} is dropped afterwards.
 * Tests are skipped when no Docker daemon is available.
 */
@Testcontainers(disabledWithoutDocker = true)
public abstract class PostgresRoutineValidationTestBase {

    @Container
    protected static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
        .withDatabaseName("testdb")
        .withUsername("test")
        .withPassword("test");

    protected Connection connection;

    protected ConfigService configService;

    protected PackageTranslationService translationService;

    @BeforeEach
    void setup() throws Exception {
        connection = DriverManager.getConnection(
            postgres.getJdbcUrl(),
            postgres.getUsername(),
            postgres.getPassword()
        );

        configService = new ConfigService();
        translationService = new PackageTranslationService();

        // Inject the configuration the way CDI would (package-private field)
        Field configField = PackageTranslationService.class.getDeclaredField("configService");
        configField.setAccessible(true);
        configField.set(translationService, configService);
    }

    @AfterEach
    void cleanup() throws SQLException {
        if (connection == null || connection.isClosed()) {
            return;
        }
        try (Statement stmt = connection.createStatement()) {
            List<String> schemas = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery(
                    "SELECT schema_name FROM information_schema.schemata "
                    + "WHERE schema_name NOT IN ('pg_catalog', 'information_schema', 'pg_toast', 'public')")) {
                while (rs.next()) {
                    schemas.add(rs.getString("schema_name"));
                }
            }
            for (String schema : schemas) {
                stmt.execute("DROP SCHEMA IF EXISTS " + schema + " CASCADE");
            }
        } finally {
            connection.close();
        }
    }

    // ========== Translation Helper Methods ==========

    protected PackageTranslationReport translate(String specSql, String bodySql) {
        return translationService.translatePackage(new PackageSource(null, null, specSql, bodySql),
                translationService.createContext());
    }

    /**
     * Creates the target schema of the package and installs every translated routine.
     */
    protected void install(PackageTranslationReport report, String targetSchema) throws SQLException {
        executeUpdate("CREATE SCHEMA IF NOT EXISTS " + targetSchema);
        for (RoutineTranslationResult result : report.getRoutineResults()) {
            if (!result.isSuccess()) {
                throw new IllegalStateException("Routine " + result.getRoutineName()
                        + " did not translate: " + result.getErrorMessage());
            }
            executeUpdate(result.getPostgresSql());
        }
    }

    // ========== Database Execution Helper Methods ==========

    protected void executeUpdate(String sql) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(sql);
        }
    }

    /**
     * Executes a query returning a single value.
     */
    protected Object queryForObject(String sql) throws SQLException {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            if (!rs.next()) {
                throw new SQLException("No row returned by: " + sql);
            }
            return rs.getObject(1);
        }
    }
}
