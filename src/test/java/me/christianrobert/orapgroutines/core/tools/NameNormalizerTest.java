package me.christianrobert.orapgroutines.core.tools;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NameNormalizerTest {

    @Test
    void normalizeIdentifier_foldsCase() {
        assertEquals("emp_cur", NameNormalizer.normalizeIdentifier("EMP_CUR"));
        assertEquals("emp_cur", NameNormalizer.normalizeIdentifier("Emp_Cur"));
    }

    @Test
    void normalizeIdentifier_stripsQuotesAndWhitespace() {
        assertEquals("empcur", NameNormalizer.normalizeIdentifier("  \"EmpCur\" "));
    }

    @Test
    void normalizeIdentifier_null() {
        assertNull(NameNormalizer.normalizeIdentifier(null));
    }

    @Test
    void normalizeQualifiedName_foldsEachPart() {
        assertEquals("hr.emp_pkg", NameNormalizer.normalizeQualifiedName("HR.\"Emp_Pkg\""));
        assertEquals("emp_pkg.c1", NameNormalizer.normalizeQualifiedName("EMP_PKG.C1"));
    }

    @Test
    void isQuoted() {
        assertTrue(NameNormalizer.isQuoted("\"x\""));
        assertFalse(NameNormalizer.isQuoted("x"));
        assertFalse(NameNormalizer.isQuoted("\""));
        assertFalse(NameNormalizer.isQuoted(null));
    }

    @Test
    void sameIdentifier_caseInsensitive() {
        assertTrue(NameNormalizer.sameIdentifier("SQL", "sql"));
        assertTrue(NameNormalizer.sameIdentifier("\"Emp_Cur\"", "EMP_CUR"));
        assertFalse(NameNormalizer.sameIdentifier("c1", "c2"));
        assertFalse(NameNormalizer.sameIdentifier("c1", null));
        assertTrue(NameNormalizer.sameIdentifier(null, null));
    }
}
