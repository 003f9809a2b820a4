package me.christianrobert.orapgroutines.transformer.model;

public enum DeclarationKind {
    CURSOR,
    VARIABLE,
    OTHER
}
