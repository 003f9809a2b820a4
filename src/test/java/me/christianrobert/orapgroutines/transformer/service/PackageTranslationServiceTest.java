package me.christianrobert.orapgroutines.transformer.service;

import me.christianrobert.orapgroutines.config.service.ConfigService;
import me.christianrobert.orapgroutines.core.job.model.routine.PackageSource;
import me.christianrobert.orapgroutines.core.job.model.routine.PackageTranslationReport;
import me.christianrobert.orapgroutines.transformer.context.RoutineTranslationResult;
import me.christianrobert.orapgroutines.transformer.context.TranslationContext;
import me.christianrobert.orapgroutines.transformer.emit.RoutineNaming;
import me.christianrobert.orapgroutines.transformer.visibility.RoutineVisibility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for PackageTranslationService: package source in, PL/pgSQL out.
 */
class PackageTranslationServiceTest {

    private static final String SPEC = """
            CREATE OR REPLACE PACKAGE hr.emp_pkg AS
              -- the only public routine
              FUNCTION f1 RETURN NUMBER;
            END emp_pkg;
            """;

    private static final String BODY = """
            CREATE OR REPLACE PACKAGE BODY hr.emp_pkg AS
              CURSOR emp_cur IS SELECT id FROM emp;

              FUNCTION f2 RETURN NUMBER IS
              BEGIN
                RETURN 2;
              END f2;

              FUNCTION f1 RETURN NUMBER IS
              BEGIN
                IF emp_cur%ISOPEN THEN
                  RETURN -1;
                END IF;
                RETURN f2;
              END f1;

              PROCEDURE purge IS
              BEGIN
                DELETE FROM emp WHERE flag = 1;
                DBMS_OUTPUT.PUT_LINE(SQL%ROWCOUNT || ' ' || x%ROWCOUNT);
              END purge;
            END emp_pkg;
            """;

    private ConfigService configService;
    private PackageTranslationService service;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
        service = new PackageTranslationService();
        service.configService = configService;
    }

    private PackageTranslationReport translate(String spec, String body) {
        return service.translatePackage(new PackageSource(null, null, spec, body), service.createContext());
    }

    // ========== Visibility ==========

    @Test
    void translatePackage_publicAndPrivateRoutines() {
        PackageTranslationReport report = translate(SPEC, BODY);

        assertAll(
                () -> assertFalse(report.isPackageFailed()),
                () -> assertEquals("hr.emp_pkg", report.getPackageName()),
                () -> assertTrue(report.isHasSpec()),
                () -> assertEquals(Set.of("f1"), report.getPublicRoutineNames()),
                () -> assertEquals(3, report.getRoutineCount()),
                () -> assertEquals(1, report.getPublicCount()),
                () -> assertEquals(2, report.getPrivateCount()),
                () -> assertEquals(3, report.getSuccessCount())
        );

        RoutineTranslationResult f1 = report.getRoutineResult("F1");
        RoutineTranslationResult f2 = report.getRoutineResult("f2");
        assertEquals(RoutineVisibility.PUBLIC, f1.getVisibility());
        assertEquals(RoutineVisibility.PRIVATE, f2.getVisibility());
        assertFalse(f1.getPostgresSql().contains("REVOKE"), f1.getPostgresSql());
        assertTrue(f2.getPostgresSql().endsWith("REVOKE ALL ON FUNCTION emp_pkg.f2() FROM PUBLIC;\n"),
                f2.getPostgresSql());
    }

    @Test
    void translatePackage_resultsFollowBodyOrder() {
        PackageTranslationReport report = translate(SPEC, BODY);

        assertEquals(List.of("f2", "f1", "purge"),
                report.getRoutineResults().stream().map(RoutineTranslationResult::getRoutineName).toList());
    }

    @Test
    void translatePackage_emptySpecMakesEveryRoutinePrivate() {
        PackageTranslationReport report = translate("   ", BODY);

        assertFalse(report.isHasSpec());
        assertTrue(report.getPublicRoutineNames().isEmpty());
        assertEquals(3, report.getPrivateCount());
        for (RoutineTranslationResult result : report.getRoutineResults()) {
            assertTrue(result.getPostgresSql().contains("REVOKE ALL ON "), result.getRoutineName());
        }
    }

    @Test
    void translatePackage_configuredGranteeIsRevoked() {
        configService.setConfigValue(ConfigService.REVOKE_GRANTEE, "app_role");

        PackageTranslationReport report = translate(SPEC, BODY);

        assertTrue(report.getRoutineResult("purge").getPostgresSql()
                .endsWith("REVOKE ALL ON PROCEDURE emp_pkg.purge() FROM app_role;\n"));
    }

    // ========== Cursor State ==========

    @Test
    void translatePackage_packageCursorIsHoistedAndNeverOpened() {
        String sql = translate(SPEC, BODY).getRoutineResult("f1").getPostgresSql();

        assertAll(
                () -> assertTrue(sql.contains("  emp_cur CURSOR FOR SELECT id FROM emp;\n"), sql),
                () -> assertTrue(sql.contains("  emp_cur__isopen boolean := FALSE;\n"), sql),
                () -> assertTrue(sql.contains("IF emp_cur__isopen THEN"), sql),
                () -> assertFalse(sql.contains("emp_cur__isopen := TRUE"), "f1 never opens the cursor")
        );
    }

    private static final String QUALIFIED_CURSOR_BODY = """
            CREATE OR REPLACE PACKAGE BODY hr.emp_pkg AS
              CURSOR c1 IS SELECT id FROM emp;

              PROCEDURE p IS
                v NUMBER;
              BEGIN
                OPEN emp_pkg.c1;
                FETCH emp_pkg.c1 INTO v;
                IF emp_pkg.c1%ISOPEN THEN
                  CLOSE emp_pkg.c1;
                END IF;
              END p;

              FUNCTION q RETURN BOOLEAN IS
                CURSOR c1 IS SELECT 2 FROM dual;
              BEGIN
                OPEN c1;
                RETURN emp_pkg.c1%ISOPEN;
              END q;
            END emp_pkg;
            """;

    @Test
    void translatePackage_qualifiedCursorStatementsDropPackagePrefix() {
        String sql = translate(null, QUALIFIED_CURSOR_BODY).getRoutineResult("p").getPostgresSql();

        assertAll(
                () -> assertFalse(sql.contains("emp_pkg.c1"), sql),
                () -> assertTrue(sql.contains("  c1 CURSOR FOR SELECT id FROM emp;\n"), sql),
                () -> assertTrue(sql.contains("  OPEN c1;\n"), sql),
                () -> assertTrue(sql.contains("  FETCH c1 INTO v;\n"), sql),
                () -> assertTrue(sql.contains("    CLOSE c1;\n"), sql),
                () -> assertTrue(sql.contains("IF c1__isopen THEN"), sql)
        );
    }

    @Test
    void translatePackage_localCursorShadowingPackageCursorIsNotRedeclared() {
        RoutineTranslationResult q = translate(null, QUALIFIED_CURSOR_BODY).getRoutineResult("q");
        String sql = q.getPostgresSql();

        assertAll(
                () -> assertTrue(q.isSuccess()),
                () -> assertTrue(sql.contains("  c1_2 CURSOR FOR SELECT id FROM emp;\n"), sql),
                () -> assertTrue(sql.contains("  c1 CURSOR FOR SELECT 2 FROM dual;\n"), sql),
                () -> assertEquals(1, sql.split(" c1 CURSOR ", -1).length - 1, sql),
                () -> assertTrue(sql.contains("  OPEN c1;\n"), sql),
                () -> assertTrue(sql.contains("RETURN c1_2__isopen;"), sql),
                () -> assertTrue(q.getUnresolvedReferences().isEmpty())
        );
    }

    @Test
    void translatePackage_packageCursorStateIsPerCall() {
        PackageTranslationReport report = translate(null, QUALIFIED_CURSOR_BODY);
        String p = report.getRoutineResult("p").getPostgresSql();
        String q = report.getRoutineResult("q").getPostgresSql();

        // each routine declares its own copy of the cursor and a flag starting closed
        assertAll(
                () -> assertTrue(p.contains("  c1__isopen boolean := FALSE;\n"), p),
                () -> assertTrue(q.contains("  c1_2__isopen boolean := FALSE;\n"), q),
                () -> assertFalse(q.contains("c1_2__isopen := TRUE"), q)
        );
    }

    @Test
    void translatePackage_unresolvedReferenceIsCountedOnce() {
        PackageTranslationReport report = translate(SPEC, BODY);
        RoutineTranslationResult purge = report.getRoutineResult("purge");

        assertAll(
                () -> assertTrue(purge.isSuccess()),
                () -> assertEquals(List.of("x%ROWCOUNT"), purge.getUnresolvedReferences()),
                () -> assertEquals(1, purge.getRewrittenReferenceCount()),
                () -> assertEquals(1, report.getUnresolvedReferenceCount()),
                () -> assertEquals(1, report.getRoutinesWithUnresolvedReferences().size()),
                () -> assertTrue(purge.getPostgresSql().contains(
                        "DBMS_OUTPUT.PUT_LINE(last__rowcount || ' ' || x%ROWCOUNT);"), purge.getPostgresSql())
        );
    }

    @Test
    void translatePackage_fetchThenRowCount() {
        PackageTranslationReport report = translate(null, """
                CREATE PACKAGE BODY fetch_pkg AS
                  PROCEDURE p IS
                    CURSOR c1 IS SELECT id FROM emp;
                    v NUMBER;
                  BEGIN
                    OPEN c1;
                    FETCH c1 INTO v;
                    DBMS_OUTPUT.PUT_LINE(c1%ROWCOUNT);
                    CLOSE c1;
                  END p;
                END fetch_pkg;
                """);

        String sql = report.getRoutineResult("p").getPostgresSql();
        assertTrue(sql.contains("""
                  FETCH c1 INTO v;
                  GET DIAGNOSTICS last__rowcount = ROW_COUNT;
                  DBMS_OUTPUT.PUT_LINE(last__rowcount);
                """), sql);
    }

    // ========== Determinism and Failures ==========

    @Test
    void translatePackage_isDeterministic() {
        PackageTranslationReport first = translate(SPEC, BODY);
        PackageTranslationReport second = translate(SPEC, BODY);

        for (int i = 0; i < first.getRoutineCount(); i++) {
            assertEquals(first.getRoutineResults().get(i).getPostgresSql(),
                    second.getRoutineResults().get(i).getPostgresSql());
        }
    }

    @Test
    void translatePackage_sameContextTwiceResolvesOnce() {
        TranslationContext context = service.createContext();
        PackageSource source = new PackageSource(null, null, SPEC, BODY);

        PackageTranslationReport first = service.translatePackage(source, context);
        PackageTranslationReport second = service.translatePackage(source, context);

        assertFalse(second.isPackageFailed());
        assertEquals(first.getPublicRoutineNames(), second.getPublicRoutineNames());
    }

    @Test
    void translatePackage_failingRoutineDoesNotStopSiblings() {
        PackageTranslationReport report = translate(null, """
                CREATE PACKAGE BODY load_pkg AS
                  PROCEDURE bulk_load IS
                    v numbers_t;
                  BEGIN
                    SELECT id BULK COLLECT INTO v FROM emp;
                  END bulk_load;

                  FUNCTION ok RETURN NUMBER IS
                  BEGIN
                    RETURN 1;
                  END ok;
                END load_pkg;
                """);

        assertAll(
                () -> assertEquals(2, report.getRoutineCount()),
                () -> assertEquals(1, report.getSuccessCount()),
                () -> assertEquals("ok", report.getRoutineResults().get(0).getRoutineName()),
                () -> assertEquals("bulk_load", report.getFailedRoutines().get(0).getRoutineName()),
                () -> assertEquals(RoutineVisibility.PRIVATE, report.getFailedRoutines().get(0).getVisibility()),
                () -> assertNotNull(report.getFailedRoutines().get(0).getErrorMessage())
        );
    }

    @Test
    void translatePackage_missingNameIsPackageFailure() {
        PackageTranslationReport report = translate(null, """
                FUNCTION f RETURN NUMBER IS
                BEGIN
                  RETURN 1;
                END f;
                """);

        assertTrue(report.isPackageFailed());
        assertEquals(0, report.getRoutineCount());
        assertTrue(report.getPackageError().contains("Package name"), report.getPackageError());
    }

    @Test
    void createContext_namingModeFromConfig() {
        configService.setConfigValue(ConfigService.NAMING_MODE, "FLATTENED");
        assertEquals(RoutineNaming.FLATTENED, service.createContext().getNaming());

        configService.setConfigValue(ConfigService.NAMING_MODE, "BY_OWNER");
        assertThrows(IllegalArgumentException.class, () -> service.createContext());
    }
}
