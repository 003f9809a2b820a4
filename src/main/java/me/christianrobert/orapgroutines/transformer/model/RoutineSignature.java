package me.christianrobert.orapgroutines.transformer.model;

import me.christianrobert.orapgroutines.core.tools.NameNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Name, kind, parameters and return type of a function or procedure.
 * Spec declarations and body definitions share this type.
 */
public class RoutineSignature {

    private final String name;
    private final RoutineKind kind;
    private final List<RoutineParameter> parameters;
    private final String returnType;

    public RoutineSignature(String name, RoutineKind kind, List<RoutineParameter> parameters, String returnType) {
        this.name = name;
        this.kind = kind;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.returnType = returnType;
    }

    public String getName() {
        return name;
    }

    /** Name folded for case-insensitive matching between spec and body */
    public String getFoldedName() {
        return NameNormalizer.normalizeIdentifier(name);
    }

    public RoutineKind getKind() {
        return kind;
    }

    public boolean isFunction() {
        return kind == RoutineKind.FUNCTION;
    }

    public List<RoutineParameter> getParameters() {
        return parameters;
    }

    /** Oracle return type, null for procedures */
    public String getReturnType() {
        return returnType;
    }

    @Override
    public String toString() {
        return kind + " " + name + "(" + parameters.size() + " params)"
                + (returnType != null ? " RETURN " + returnType : "");
    }
}
