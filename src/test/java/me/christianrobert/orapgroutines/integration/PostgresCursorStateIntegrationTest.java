package me.christianrobert.orapgroutines.integration;

import me.christianrobert.orapgroutines.core.job.model.routine.PackageTranslationReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Installs a translated package into PostgreSQL and checks that the shadow variables
 * reproduce Oracle's cursor attribute semantics at run time.
 */
class PostgresCursorStateIntegrationTest extends PostgresRoutineValidationTestBase {

    private static final String SPEC = """
            CREATE OR REPLACE PACKAGE emp_pkg AS
              FUNCTION count_rows RETURN NUMBER;
              FUNCTION flag_all RETURN NUMBER;
              FUNCTION open_state RETURN VARCHAR2;
            END emp_pkg;
            """;

    private static final String BODY = """
            CREATE OR REPLACE PACKAGE BODY emp_pkg AS
              CURSOR emp_cur IS SELECT id FROM hr.emp ORDER BY id;

              FUNCTION count_rows RETURN NUMBER IS
                v_id NUMBER;
                v_count NUMBER := 0;
              BEGIN
                OPEN emp_cur;
                LOOP
                  FETCH emp_cur INTO v_id;
                  EXIT WHEN emp_cur%NOTFOUND;
                  v_count := v_count + 1;
                END LOOP;
                CLOSE emp_cur;
                RETURN v_count;
              END count_rows;

              FUNCTION flag_all RETURN NUMBER IS
              BEGIN
                UPDATE hr.emp SET flag = 1 WHERE flag = 0;
                RETURN SQL%ROWCOUNT;
              END flag_all;

              FUNCTION open_state RETURN VARCHAR2 IS
                v_result VARCHAR2(20);
              BEGIN
                v_result := CASE WHEN emp_cur%ISOPEN THEN 'open' ELSE 'closed' END;
                OPEN emp_cur;
                IF emp_cur%ISOPEN THEN
                  v_result := v_result || '/open';
                END IF;
                CLOSE emp_cur;
                IF NOT emp_cur%ISOPEN THEN
                  v_result := v_result || '/closed';
                END IF;
                RETURN v_result;
              END open_state;

              FUNCTION helper RETURN NUMBER IS
              BEGIN
                RETURN 42;
              END helper;
            END emp_pkg;
            """;

    @BeforeEach
    void setupTestData() throws SQLException {
        executeUpdate("CREATE SCHEMA hr");
        executeUpdate("CREATE TABLE hr.emp (id INT PRIMARY KEY, flag INT NOT NULL)");
        executeUpdate("INSERT INTO hr.emp VALUES (1, 0), (2, 0), (3, 1)");
    }

    @Test
    void translatedPackageRunsWithOracleSemantics() throws SQLException {
        PackageTranslationReport report = translate(SPEC, BODY);
        assertEquals(4, report.getSuccessCount(), report.toString());

        install(report, "emp_pkg");

        assertAll(
                () -> assertEquals(3, ((Number) queryForObject("SELECT emp_pkg.count_rows()")).intValue(),
                        "Loop exits after the last row via the found flag"),
                () -> assertEquals(2, ((Number) queryForObject("SELECT emp_pkg.flag_all()")).intValue(),
                        "SQL%ROWCOUNT reports the rows of the UPDATE"),
                () -> assertEquals(0, ((Number) queryForObject("SELECT emp_pkg.flag_all()")).intValue(),
                        "Second run updates nothing"),
                () -> assertEquals("closed/open/closed", queryForObject("SELECT emp_pkg.open_state()"))
        );
    }

    @Test
    void privateRoutineIsRevokedFromPublic() throws SQLException {
        PackageTranslationReport report = translate(SPEC, BODY);
        install(report, "emp_pkg");

        executeUpdate("DROP ROLE IF EXISTS reader_role");
        executeUpdate("CREATE ROLE reader_role");
        try {
            assertEquals(Boolean.TRUE, queryForObject(
                    "SELECT has_function_privilege('reader_role', 'emp_pkg.count_rows()', 'EXECUTE')"));
            assertEquals(Boolean.FALSE, queryForObject(
                    "SELECT has_function_privilege('reader_role', 'emp_pkg.helper()', 'EXECUTE')"));
            assertEquals(42, ((Number) queryForObject("SELECT emp_pkg.helper()")).intValue(),
                    "The owner keeps access");
        } finally {
            executeUpdate("DROP ROLE IF EXISTS reader_role");
        }
    }

    @Test
    void qualifiedAndShadowedPackageCursorsInstallAndRun() throws SQLException {
        PackageTranslationReport report = translate("""
                CREATE OR REPLACE PACKAGE cur_pkg AS
                  FUNCTION first_id RETURN NUMBER;
                  FUNCTION which_open RETURN VARCHAR2;
                END cur_pkg;
                """, """
                CREATE OR REPLACE PACKAGE BODY cur_pkg AS
                  CURSOR c1 IS SELECT id FROM hr.emp ORDER BY id;

                  FUNCTION first_id RETURN NUMBER IS
                    v NUMBER;
                  BEGIN
                    OPEN cur_pkg.c1;
                    FETCH cur_pkg.c1 INTO v;
                    IF cur_pkg.c1%ISOPEN THEN
                      CLOSE cur_pkg.c1;
                    END IF;
                    RETURN v;
                  END first_id;

                  FUNCTION which_open RETURN VARCHAR2 IS
                    CURSOR c1 IS SELECT 2 FROM hr.emp;
                  BEGIN
                    OPEN c1;
                    IF cur_pkg.c1%ISOPEN THEN
                      RETURN 'package';
                    END IF;
                    CLOSE c1;
                    RETURN 'local';
                  END which_open;
                END cur_pkg;
                """);
        assertEquals(2, report.getSuccessCount(), report.toString());

        install(report, "cur_pkg");

        assertAll(
                () -> assertEquals(1, ((Number) queryForObject("SELECT cur_pkg.first_id()")).intValue()),
                () -> assertEquals("local", queryForObject("SELECT cur_pkg.which_open()"),
                        "Opening the local c1 leaves the package cursor's flag alone")
        );
    }
}
