package me.christianrobert.orapgroutines.transformer.model.statement;

public enum StatementKind {
    OPEN,
    CLOSE,
    FETCH,
    MODIFYING,
    OTHER,
    BLOCK
}
