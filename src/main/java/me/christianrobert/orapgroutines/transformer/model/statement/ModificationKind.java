package me.christianrobert.orapgroutines.transformer.model.statement;

/**
 * Statements whose affected-row count the target reports through GET DIAGNOSTICS.
 */
public enum ModificationKind {
    INSERT,
    UPDATE,
    DELETE,
    MERGE,
    SELECT_INTO
}
