package me.christianrobert.orapgroutines.transformer.model.statement;

import me.christianrobert.orapgroutines.transformer.model.token.SqlToken;
import me.christianrobert.orapgroutines.transformer.model.token.SqlTokens;

import java.util.List;

/**
 * A discrete executable statement node of a routine body.
 *
 * <p>Every statement parsed from source has a routine-unique, non-negative ordinal
 * assigned in source order (nested blocks included). Analysis results refer to
 * statements by ordinal, so positions stay valid while a rewrite re-materializes
 * the body. Statements created by a rewrite are synthesized and have ordinal -1.
 *
 * <p>Tokens cover the complete statement text including keywords and the
 * terminating semicolon; whitespace at both ends is trimmed.
 */
public abstract class PlSqlStatement {

    public static final int SYNTHESIZED = -1;

    private final int ordinal;
    private final List<SqlToken> tokens;

    protected PlSqlStatement(int ordinal, List<SqlToken> tokens) {
        this.ordinal = ordinal;
        this.tokens = SqlTokens.immutableCopy(tokens);
    }

    public int getOrdinal() {
        return ordinal;
    }

    public List<SqlToken> getTokens() {
        return tokens;
    }

    public String getText() {
        return SqlToken.join(tokens);
    }

    public boolean isSynthesized() {
        return ordinal == SYNTHESIZED;
    }

    public abstract StatementKind getKind();

    public abstract <R> R accept(StatementVisitor<R> visitor);

    /**
     * Copy of this statement with the same kind and ordinal but different tokens.
     */
    public abstract PlSqlStatement withTokens(List<SqlToken> newTokens);

    @Override
    public String toString() {
        return getKind() + "#" + ordinal + "[" + getText() + "]";
    }
}
