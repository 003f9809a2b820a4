package me.christianrobert.orapgroutines.transformer.cursor;

/**
 * Where a cursor referenced by a routine is declared.
 */
public enum CursorScope {
    /** Declaration section of the routine itself */
    ROUTINE,
    /** A nested DECLARE block inside the routine */
    NESTED_BLOCK,
    /** Package body level; the declaration is hoisted into the routine */
    PACKAGE,
    /** The implicit SQL cursor */
    IMPLICIT
}
