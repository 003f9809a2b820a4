package me.christianrobert.orapgroutines.transformer.model;

import me.christianrobert.orapgroutines.transformer.model.token.SqlToken;
import me.christianrobert.orapgroutines.transformer.model.token.SqlTokens;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code CURSOR name [(param type, ...)] [RETURN type] IS query;}
 */
public class CursorDeclaration extends Declaration {

    private final List<RoutineParameter> parameters;
    private final List<SqlToken> queryTokens;

    public CursorDeclaration(String name, List<RoutineParameter> parameters,
                             List<SqlToken> queryTokens, List<SqlToken> tokens) {
        super(name, tokens);
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.queryTokens = SqlTokens.immutableCopy(queryTokens);
    }

    public List<RoutineParameter> getParameters() {
        return parameters;
    }

    public List<SqlToken> getQueryTokens() {
        return queryTokens;
    }

    /**
     * Same cursor declared under another name. Source tokens are kept as they were.
     */
    public CursorDeclaration withName(String newName) {
        return new CursorDeclaration(newName, parameters, queryTokens, getTokens());
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.CURSOR;
    }

    @Override
    public String toString() {
        return "CursorDeclaration{" + getName() + ", parameters=" + parameters.size() + "}";
    }
}
