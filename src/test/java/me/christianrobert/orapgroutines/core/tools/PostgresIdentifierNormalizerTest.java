package me.christianrobert.orapgroutines.core.tools;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for smart quoting of PostgreSQL identifiers in emitted routine headers.
 */
class PostgresIdentifierNormalizerTest {

    @Test
    void normalizeIdentifier_plainNamesAreLowercasedUnquoted() {
        assertEquals("emp_pkg", PostgresIdentifierNormalizer.normalizeIdentifier("EMP_PKG"));
        assertEquals("get_salary", PostgresIdentifierNormalizer.normalizeIdentifier("Get_Salary"));
    }

    @Test
    void normalizeIdentifier_reservedWordsAreQuoted() {
        assertEquals("\"order\"", PostgresIdentifierNormalizer.normalizeIdentifier("ORDER"));
        assertEquals("\"user\"", PostgresIdentifierNormalizer.normalizeIdentifier("user"));
    }

    @Test
    void normalizeIdentifier_specialCharactersAreQuoted() {
        assertEquals("\"calc$total\"", PostgresIdentifierNormalizer.normalizeIdentifier("CALC$TOTAL"));
        assertEquals("\"emp#\"", PostgresIdentifierNormalizer.normalizeIdentifier("EMP#"));
    }

    @Test
    void normalizeQualifiedIdentifier_quotesPerPart() {
        assertEquals("hr.\"user\"", PostgresIdentifierNormalizer.normalizeQualifiedIdentifier("HR.USER"));
        assertEquals("emp_pkg.get_salary",
                PostgresIdentifierNormalizer.normalizeQualifiedIdentifier("EMP_PKG.GET_SALARY"));
    }

    @Test
    void isReservedWord() {
        assertTrue(PostgresIdentifierNormalizer.isReservedWord("Select"));
        assertFalse(PostgresIdentifierNormalizer.isReservedWord("salary"));
        assertFalse(PostgresIdentifierNormalizer.isReservedWord(null));
    }
}
