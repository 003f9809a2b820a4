package me.christianrobert.orapgroutines.transformer.model;

public enum RoutineKind {
    FUNCTION,
    PROCEDURE
}
