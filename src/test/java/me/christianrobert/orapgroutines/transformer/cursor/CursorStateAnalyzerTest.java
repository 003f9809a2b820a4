package me.christianrobert.orapgroutines.transformer.cursor;

import me.christianrobert.orapgroutines.transformer.model.CursorDeclaration;
import me.christianrobert.orapgroutines.transformer.model.RoutineDefinition;
import me.christianrobert.orapgroutines.transformer.model.token.CursorAttribute;
import me.christianrobert.orapgroutines.transformer.parser.RoutineBodyParser;
import me.christianrobert.orapgroutines.transformer.parser.SqlTokenizer;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CursorStateAnalyzer: cursor resolution by scope, statement positions
 * and unresolved attribute references.
 */
class CursorStateAnalyzerTest {

    private final CursorStateAnalyzer analyzer = new CursorStateAnalyzer();

    static RoutineDefinition parse(String sql) {
        return new RoutineBodyParser().parseRoutine(new SqlTokenizer().tokenize(sql));
    }

    static CursorDeclaration packageCursor(String sql) {
        return (CursorDeclaration) new RoutineBodyParser().parseDeclaration(new SqlTokenizer().tokenize(sql));
    }

    private static final String FETCH_LOOP = """
            PROCEDURE p IS
              CURSOR c1 IS SELECT id FROM emp;
              v_id NUMBER;
            BEGIN
              OPEN c1;
              LOOP
                FETCH c1 INTO v_id;
                EXIT WHEN c1%NOTFOUND;
                UPDATE emp SET flag = 1 WHERE id = v_id;
              END LOOP;
              IF c1%ISOPEN THEN
                CLOSE c1;
              END IF;
              DBMS_OUTPUT.PUT_LINE(SQL%ROWCOUNT);
            END p;
            """;

    @Test
    void analyze_recordsOpenFetchCloseAndReferences() {
        CursorAnalysis analysis = analyzer.analyze(parse(FETCH_LOOP));

        assertEquals(1, analysis.getUsages().size());
        CursorUsage c1 = analysis.getUsages().get(0);
        assertAll(
                () -> assertEquals("block0.c1", c1.getKey()),
                () -> assertEquals(CursorScope.ROUTINE, c1.getScope()),
                () -> assertEquals(List.of(0), c1.getOpenOrdinals()),
                () -> assertEquals(List.of(2), c1.getFetchOrdinals()),
                () -> assertEquals(List.of(7), c1.getCloseOrdinals()),
                () -> assertTrue(c1.needsOpenFlag()),
                () -> assertTrue(c1.needsFoundFlag()),
                () -> assertFalse(c1.readsRowCount())
        );
        assertEquals(List.of(
                new AttributeReferenceSite(3, "c1", CursorAttribute.NOTFOUND),
                new AttributeReferenceSite(6, "c1", CursorAttribute.ISOPEN)), c1.getReferences());

        assertEquals("block0.c1", analysis.getCursorKeyAt(0));
        assertEquals("block0.c1", analysis.getCursorKeyAt(7));
        assertNull(analysis.getCursorKeyAt(1), "LOOP header is not a cursor statement");
    }

    @Test
    void analyze_implicitCursorAndRowCountRefreshPoints() {
        CursorAnalysis analysis = analyzer.analyze(parse(FETCH_LOOP));

        assertTrue(analysis.getImplicitCursor().readsRowCount());
        assertTrue(analysis.requiresRowCount());
        assertEquals(List.of("sql"), analysis.getReferenceKeysAt(9));
        assertEquals(Set.of(2, 4), analysis.getRowCountRefreshOrdinals(), "Every FETCH and modifying statement");
        assertTrue(analysis.getUnresolvedReferences().isEmpty());
        assertEquals(3, analysis.getResolvedReferenceCount());
    }

    @Test
    void analyze_innermostDeclarationWins() {
        CursorAnalysis analysis = analyzer.analyze(parse("""
                PROCEDURE p IS
                  CURSOR c1 IS SELECT 1 FROM dual;
                BEGIN
                  OPEN c1;
                  DECLARE
                    CURSOR c1 IS SELECT 2 FROM dual;
                  BEGIN
                    OPEN c1;
                    IF c1%ISOPEN THEN NULL; END IF;
                  END;
                  IF c1%ISOPEN THEN NULL; END IF;
                END p;
                """));

        assertEquals(2, analysis.getUsages().size());
        CursorUsage outer = analysis.getUsage("block0.c1");
        CursorUsage inner = analysis.getUsage("block1.c1");
        assertAll(
                () -> assertEquals(CursorScope.ROUTINE, outer.getScope()),
                () -> assertEquals(CursorScope.NESTED_BLOCK, inner.getScope()),
                () -> assertEquals(1, inner.getDeclaringBlockId()),
                () -> assertEquals(List.of(0), outer.getOpenOrdinals()),
                () -> assertEquals(List.of(2), inner.getOpenOrdinals()),
                () -> assertEquals(List.of("block1.c1"), analysis.getReferenceKeysAt(3)),
                () -> assertEquals(List.of("block0.c1"), analysis.getReferenceKeysAt(6),
                        "After the nested block ends, the outer cursor is visible again")
        );
        assertEquals(1, analysis.getUsagesDeclaredIn(1).size());
    }

    @Test
    void analyze_packageCursorsResolveAfterLocalScopes() {
        List<CursorDeclaration> packageCursors = List.of(
                packageCursor("CURSOR emp_cur IS SELECT * FROM emp;"),
                packageCursor("CURSOR unused_cur IS SELECT * FROM dept;"));

        CursorAnalysis analysis = analyzer.analyze(parse("""
                FUNCTION is_open RETURN BOOLEAN IS
                BEGIN
                  RETURN emp_cur%ISOPEN OR hr.emp_pkg.emp_cur%ISOPEN OR emp_pkg.emp_cur%ISOPEN;
                END is_open;
                """), "hr.emp_pkg", packageCursors);

        assertEquals(Arrays.asList("package.emp_cur", "package.emp_cur", "package.emp_cur"),
                analysis.getReferenceKeysAt(0), "Plain and own-package-qualified names resolve");
        assertEquals(1, analysis.getHoistedCursors().size(), "Only used package cursors are hoisted");
        assertEquals("emp_cur", analysis.getHoistedCursors().get(0).getName());
        assertEquals(CursorScope.PACKAGE, analysis.getHoistedCursors().get(0).getScope());
    }

    @Test
    void analyze_otherPackageQualifierDoesNotResolve() {
        CursorAnalysis analysis = analyzer.analyze(parse("""
                FUNCTION f RETURN BOOLEAN IS
                BEGIN
                  RETURN other_pkg.emp_cur%ISOPEN;
                END f;
                """), "emp_pkg", List.of(packageCursor("CURSOR emp_cur IS SELECT * FROM emp;")));

        assertEquals(1, analysis.getUnresolvedReferences().size());
        assertEquals("other_pkg.emp_cur", analysis.getUnresolvedReferences().get(0).getCursorName());
        assertTrue(analysis.getHoistedCursors().isEmpty());
    }

    @Test
    void analyze_unresolvedReferenceIsRecordedOnce() {
        CursorAnalysis analysis = analyzer.analyze(parse("""
                FUNCTION f RETURN NUMBER IS
                BEGIN
                  RETURN x%ROWCOUNT;
                END f;
                """));

        assertEquals(List.of(new AttributeReferenceSite(0, "x", CursorAttribute.ROWCOUNT)),
                analysis.getUnresolvedReferences());
        assertEquals(Arrays.asList((String) null), analysis.getReferenceKeysAt(0));
        assertFalse(analysis.requiresRowCount(), "An unresolved reference reads no shadow variable");
    }

    @Test
    void analyze_cursorVariableOpenIsNotTracked() {
        CursorAnalysis analysis = analyzer.analyze(parse("""
                PROCEDURE p(rc OUT SYS_REFCURSOR) IS
                BEGIN
                  OPEN rc FOR SELECT * FROM emp;
                END p;
                """));

        assertTrue(analysis.getUsages().isEmpty());
        assertNull(analysis.getCursorKeyAt(0));
    }

    @Test
    void analyze_collectsRoutineIdentifiers() {
        CursorAnalysis analysis = analyzer.analyze(parse("""
                PROCEDURE p(p_in NUMBER) IS
                  c1__isopen BOOLEAN;
                  CURSOR c1 IS SELECT id FROM emp;
                BEGIN
                  last__rowcount := 1;
                END p;
                """));

        Set<String> identifiers = analysis.getRoutineIdentifiers();
        assertAll(
                () -> assertTrue(identifiers.contains("p")),
                () -> assertTrue(identifiers.contains("p_in")),
                () -> assertTrue(identifiers.contains("c1__isopen")),
                () -> assertTrue(identifiers.contains("c1")),
                () -> assertTrue(identifiers.contains("emp")),
                () -> assertTrue(identifiers.contains("last__rowcount"))
        );
    }

    @Test
    void analyze_declaredNamesCoverEveryBlockButNotReferences() {
        CursorAnalysis analysis = analyzer.analyze(parse("""
                PROCEDURE p(p_in NUMBER) IS
                  v NUMBER;
                BEGIN
                  OPEN c1;
                  DECLARE
                    CURSOR c2 IS SELECT 1 FROM dual;
                  BEGIN
                    NULL;
                  END;
                END p;
                """), "emp_pkg", List.of(packageCursor("CURSOR c1 IS SELECT id FROM emp;")));

        assertEquals(Set.of("p", "p_in", "v", "c2"), analysis.getDeclaredNames());
    }
}
