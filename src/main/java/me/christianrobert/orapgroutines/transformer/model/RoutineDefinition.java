package me.christianrobert.orapgroutines.transformer.model;

import java.util.Objects;

/**
 * A routine implemented in a package body (or a standalone routine).
 */
public class RoutineDefinition {

    private final RoutineSignature signature;
    private final PlSqlBlock body;

    public RoutineDefinition(RoutineSignature signature, PlSqlBlock body) {
        this.signature = Objects.requireNonNull(signature, "signature");
        this.body = Objects.requireNonNull(body, "body");
    }

    public RoutineSignature getSignature() {
        return signature;
    }

    public PlSqlBlock getBody() {
        return body;
    }

    public String getName() {
        return signature.getName();
    }

    @Override
    public String toString() {
        return "RoutineDefinition{" + signature + "}";
    }
}
