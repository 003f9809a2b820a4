package me.christianrobert.orapgroutines.transformer.parser;

import me.christianrobert.orapgroutines.transformer.model.OraclePackage;
import me.christianrobert.orapgroutines.transformer.model.RoutineDefinition;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PackageUnitBuilderTest {

    private final PackageUnitBuilder builder = new PackageUnitBuilder();

    private static final String SPEC = """
            CREATE OR REPLACE PACKAGE hr.emp_pkg AS
              /* public API */
              FUNCTION f1(p_id NUMBER) RETURN NUMBER;
            END emp_pkg;
            """;

    private static final String BODY = """
            CREATE OR REPLACE PACKAGE BODY hr.emp_pkg AS
              CURSOR emp_cur IS SELECT id FROM emp;
              g_total NUMBER := 0;

              FUNCTION f1(p_id NUMBER) RETURN NUMBER IS
              BEGIN
                RETURN f2(p_id);
              END f1;

              FUNCTION f2(p_id NUMBER) RETURN NUMBER IS
              BEGIN
                RETURN p_id * 2; -- doubled
              END f2;
            END emp_pkg;
            """;

    @Test
    void build_takesNamesFromHeader() {
        PackageParseResult result = builder.build(null, null, SPEC, BODY);
        OraclePackage pkg = result.getOraclePackage();

        assertAll(
                () -> assertEquals("hr", pkg.getSchema()),
                () -> assertEquals("emp_pkg", pkg.getName()),
                () -> assertEquals("hr.emp_pkg", pkg.getPackageKey()),
                () -> assertTrue(pkg.hasSpec()),
                () -> assertFalse(result.hasFailures())
        );
    }

    @Test
    void build_explicitNamesWin() {
        OraclePackage pkg = builder.build("SALES", "ORDERS_PKG", SPEC, BODY).getOraclePackage();

        assertEquals("SALES", pkg.getSchema());
        assertEquals("ORDERS_PKG", pkg.getName());
        assertEquals("sales.orders_pkg", pkg.getPackageKey());
    }

    @Test
    void build_collectsSpecRoutinesBodyRoutinesAndPackageCursors() {
        OraclePackage pkg = builder.build(null, null, SPEC, BODY).getOraclePackage();

        assertEquals(1, pkg.getSpecRoutines().size());
        assertEquals("f1", pkg.getSpecRoutines().get(0).getName());
        assertEquals(2, pkg.getBodyRoutines().size());
        assertEquals("f1", pkg.getBodyRoutines().get(0).getName());
        assertEquals("f2", pkg.getBodyRoutines().get(1).getName());
        assertEquals(1, pkg.getPackageCursors().size(), "Only cursors are kept from package-level declarations");
        assertEquals("emp_cur", pkg.getPackageCursors().get(0).getName());
    }

    @Test
    void build_withoutSpec() {
        OraclePackage pkg = builder.build(null, null, "  ", BODY).getOraclePackage();

        assertFalse(pkg.hasSpec());
        assertTrue(pkg.getSpecRoutines().isEmpty());
        assertEquals(2, pkg.getBodyRoutines().size());
    }

    @Test
    void build_failingRoutineIsReportedAndSiblingsSurvive() {
        String body = """
                CREATE OR REPLACE PACKAGE BODY emp_pkg AS
                  PROCEDURE good IS
                  BEGIN
                    NULL;
                  END good;

                  PROCEDURE bad IS
                  BEGIN
                    FETCH c1 BULK COLLECT INTO v_ids;
                  END bad;

                  PROCEDURE also_good IS
                  BEGIN
                    NULL;
                  END also_good;
                END emp_pkg;
                """;

        PackageParseResult result = builder.build(null, null, null, body);

        assertEquals(2, result.getOraclePackage().getBodyRoutines().size());
        assertEquals("good", result.getOraclePackage().getBodyRoutines().get(0).getName());
        assertEquals("also_good", result.getOraclePackage().getBodyRoutines().get(1).getName());

        assertTrue(result.hasFailures());
        assertEquals(1, result.getFailures().size());
        PackageParseResult.RoutineParseFailure failure = result.getFailures().get(0);
        assertEquals("bad", failure.getRoutineName());
        assertTrue(failure.getMessage().contains("BULK COLLECT"), failure.getMessage());
    }

    @Test
    void build_forwardDeclarationsAreNotRoutines() {
        String body = """
                PROCEDURE later;
                PROCEDURE first IS
                BEGIN
                  later;
                END first;
                PROCEDURE later IS
                BEGIN
                  NULL;
                END later;
                """;

        OraclePackage pkg = builder.build("hr", "fwd_pkg", null, body).getOraclePackage();

        assertEquals(2, pkg.getBodyRoutines().size());
        for (RoutineDefinition routine : pkg.getBodyRoutines()) {
            assertNotNull(routine.getBody());
        }
    }

    @Test
    void build_withoutAnyName() {
        String body = """
                PROCEDURE p IS
                BEGIN
                  NULL;
                END p;
                """;

        assertThrows(IllegalArgumentException.class, () -> builder.build(null, null, null, body));
    }
}
