package me.christianrobert.orapgroutines.transformer.model;

import me.christianrobert.orapgroutines.core.tools.NameNormalizer;
import me.christianrobert.orapgroutines.transformer.model.token.SqlToken;
import me.christianrobert.orapgroutines.transformer.model.token.SqlTokens;

import java.util.List;

/**
 * An entry of a block's declaration section.
 */
public abstract class Declaration {

    private final String name;
    private final List<SqlToken> tokens;

    protected Declaration(String name, List<SqlToken> tokens) {
        this.name = name;
        this.tokens = SqlTokens.immutableCopy(tokens);
    }

    /** Declared name as written, null if the declaration introduces none (PRAGMA) */
    public String getName() {
        return name;
    }

    public String getFoldedName() {
        return NameNormalizer.normalizeIdentifier(name);
    }

    /** Original source tokens, empty for synthesized declarations */
    public List<SqlToken> getTokens() {
        return tokens;
    }

    public abstract DeclarationKind getKind();
}
