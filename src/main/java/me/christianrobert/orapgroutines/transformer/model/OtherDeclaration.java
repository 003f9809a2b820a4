package me.christianrobert.orapgroutines.transformer.model;

import me.christianrobert.orapgroutines.transformer.model.token.SqlToken;

import java.util.List;

/**
 * Types, exceptions, pragmas and anything else kept verbatim.
 */
public class OtherDeclaration extends Declaration {

    public OtherDeclaration(String name, List<SqlToken> tokens) {
        super(name, tokens);
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.OTHER;
    }
}
