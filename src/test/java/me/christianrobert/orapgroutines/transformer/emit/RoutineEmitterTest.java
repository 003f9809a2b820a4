package me.christianrobert.orapgroutines.transformer.emit;

import me.christianrobert.orapgroutines.transformer.context.RoutineTranslationResult;
import me.christianrobert.orapgroutines.transformer.cursor.CursorAttributeRewriter;
import me.christianrobert.orapgroutines.transformer.cursor.CursorStateAnalyzer;
import me.christianrobert.orapgroutines.transformer.cursor.TransformedRoutine;
import me.christianrobert.orapgroutines.transformer.model.OraclePackage;
import me.christianrobert.orapgroutines.transformer.model.RoutineDefinition;
import me.christianrobert.orapgroutines.transformer.parser.RoutineBodyParser;
import me.christianrobert.orapgroutines.transformer.parser.SqlTokenizer;
import me.christianrobert.orapgroutines.transformer.visibility.RoutineVisibility;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoutineEmitterTest {

    private static TransformedRoutine transform(String sql) {
        RoutineDefinition routine = new RoutineBodyParser().parseRoutine(new SqlTokenizer().tokenize(sql));
        return new CursorAttributeRewriter().rewrite(routine, new CursorStateAnalyzer().analyze(routine));
    }

    private static final String GET_COUNT = """
            FUNCTION get_count(p_dept NUMBER) RETURN NUMBER IS
              v NUMBER;
            BEGIN
              SELECT COUNT(*) INTO v FROM emp WHERE dept = p_dept;
              RETURN v;
            END get_count;
            """;

    private static final String LOG_MSG = """
            PROCEDURE log_msg(p_msg VARCHAR2, p_out OUT NUMBER) IS
            BEGIN
              p_out := 1;
            END log_msg;
            """;

    // ========== Rendering ==========

    @Test
    void render_publicFunction() {
        RoutineEmitter emitter = new RoutineEmitter(RoutineNaming.SCHEMA_PER_PACKAGE, "PUBLIC");

        String sql = emitter.render("emp_pkg.get_count", transform(GET_COUNT), RoutineVisibility.PUBLIC);

        String expected = """
                CREATE OR REPLACE FUNCTION emp_pkg.get_count(p_dept numeric)
                RETURNS numeric
                LANGUAGE plpgsql
                AS $$
                DECLARE
                  v numeric;
                BEGIN
                  SELECT COUNT(*) INTO v FROM emp WHERE dept = p_dept;
                  RETURN v;
                END;
                $$;
                """;
        assertEquals(expected, sql);
        assertFalse(sql.contains("REVOKE"), "Public routines keep their default privileges");
    }

    @Test
    void render_privateProcedureIsRevoked() {
        RoutineEmitter emitter = new RoutineEmitter(RoutineNaming.SCHEMA_PER_PACKAGE, "app_users");

        String sql = emitter.render("emp_pkg.log_msg", transform(LOG_MSG), RoutineVisibility.PRIVATE);

        String expected = """
                CREATE OR REPLACE PROCEDURE emp_pkg.log_msg(p_msg text, OUT p_out numeric)
                LANGUAGE plpgsql
                AS $$
                BEGIN
                  p_out := 1;
                END;
                $$;

                REVOKE ALL ON PROCEDURE emp_pkg.log_msg(text, numeric) FROM app_users;
                """;
        assertEquals(expected, sql);
    }

    @Test
    void render_privateFunctionOmitsOutParametersFromIdentity() {
        RoutineEmitter emitter = new RoutineEmitter(RoutineNaming.SCHEMA_PER_PACKAGE, null);

        String sql = emitter.render("emp_pkg.split", transform("""
                FUNCTION split(p_in VARCHAR2, p_rest OUT VARCHAR2) RETURN VARCHAR2 IS
                BEGIN
                  p_rest := NULL;
                  RETURN p_in;
                END split;
                """), RoutineVisibility.PRIVATE);

        assertTrue(sql.endsWith("REVOKE ALL ON FUNCTION emp_pkg.split(text) FROM PUBLIC;\n"), sql);
    }

    @Test
    void render_bodyContainingDollarQuotesUsesTaggedQuote() {
        RoutineEmitter emitter = new RoutineEmitter(RoutineNaming.SCHEMA_PER_PACKAGE, "PUBLIC");

        String sql = emitter.render("pkg.f", transform("""
                FUNCTION f RETURN VARCHAR2 IS
                BEGIN
                  RETURN '$$';
                END f;
                """), RoutineVisibility.PUBLIC);

        assertTrue(sql.contains("AS $body$\n"), sql);
        assertTrue(sql.contains("\n$body$;\n"), sql);
    }

    // ========== Emission ==========

    @Test
    void emit_resultCarriesNamesAndCounts() {
        RoutineEmitter emitter = new RoutineEmitter(RoutineNaming.FLATTENED, "PUBLIC");
        OraclePackage owner = new OraclePackage("HR", "EMP_PKG", true,
                Collections.emptyList(), Collections.emptyList(), Collections.emptyList());

        RoutineTranslationResult result = emitter.emit(owner, transform("""
                FUNCTION rows_touched RETURN NUMBER IS
                BEGIN
                  UPDATE emp SET flag = 0;
                  RETURN SQL%ROWCOUNT + x%ROWCOUNT;
                END rows_touched;
                """), RoutineVisibility.PUBLIC);

        assertAll(
                () -> assertTrue(result.isSuccess()),
                () -> assertEquals("hr.emp_pkg__rows_touched", result.getTargetName()),
                () -> assertEquals(RoutineVisibility.PUBLIC, result.getVisibility()),
                () -> assertEquals(1, result.getRewrittenReferenceCount()),
                () -> assertEquals(List.of("x%ROWCOUNT"), result.getUnresolvedReferences()),
                () -> assertTrue(result.getPostgresSql().startsWith(
                        "CREATE OR REPLACE FUNCTION hr.emp_pkg__rows_touched()\n"))
        );
    }

    // ========== Naming ==========

    @Test
    void naming_modes() {
        assertAll(
                () -> assertEquals("emp_pkg.get_salary",
                        RoutineNaming.SCHEMA_PER_PACKAGE.qualifiedName("HR", "EMP_PKG", "GET_SALARY")),
                () -> assertEquals("hr.emp_pkg__get_salary",
                        RoutineNaming.FLATTENED.qualifiedName("HR", "EMP_PKG", "GET_SALARY")),
                () -> assertEquals("emp_pkg__get_salary",
                        RoutineNaming.FLATTENED.qualifiedName(null, "EMP_PKG", "GET_SALARY")),
                () -> assertEquals("emp_pkg.\"order\"",
                        RoutineNaming.SCHEMA_PER_PACKAGE.qualifiedName(null, "EMP_PKG", "ORDER"))
        );
    }

    @Test
    void naming_targetNamespace() {
        assertAll(
                () -> assertEquals(RoutineNaming.SCHEMA_PER_PACKAGE.targetNamespace("HR", "EMP_PKG"),
                        RoutineNaming.SCHEMA_PER_PACKAGE.targetNamespace("SALES", "EMP_PKG")),
                () -> assertEquals("hr.emp_pkg__", RoutineNaming.FLATTENED.targetNamespace("HR", "EMP_PKG")),
                () -> assertNotEquals(RoutineNaming.FLATTENED.targetNamespace("HR", "EMP_PKG"),
                        RoutineNaming.FLATTENED.targetNamespace("SALES", "EMP_PKG"))
        );
    }

    @Test
    void naming_fromConfig() {
        assertEquals(RoutineNaming.DEFAULT, RoutineNaming.fromConfig(null));
        assertEquals(RoutineNaming.DEFAULT, RoutineNaming.fromConfig("  "));
        assertEquals(RoutineNaming.FLATTENED, RoutineNaming.fromConfig("flattened"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> RoutineNaming.fromConfig("PER_ROUTINE"));
        assertTrue(e.getMessage().contains("PER_ROUTINE"));
    }
}
