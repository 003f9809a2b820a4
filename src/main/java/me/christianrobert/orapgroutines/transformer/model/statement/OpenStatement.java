package me.christianrobert.orapgroutines.transformer.model.statement;

import me.christianrobert.orapgroutines.transformer.model.token.SqlToken;

import java.util.List;

/**
 * {@code OPEN cursor [(args)];} or {@code OPEN refcursor FOR query;}
 */
public class OpenStatement extends PlSqlStatement {

    private final String cursorName;
    private final boolean forQuery;

    public OpenStatement(int ordinal, List<SqlToken> tokens, String cursorName, boolean forQuery) {
        super(ordinal, tokens);
        this.cursorName = cursorName;
        this.forQuery = forQuery;
    }

    /** Cursor name as written, possibly package-qualified */
    public String getCursorName() {
        return cursorName;
    }

    /** True for {@code OPEN x FOR ...} (cursor variable) */
    public boolean isForQuery() {
        return forQuery;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.OPEN;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitOpen(this);
    }

    @Override
    public OpenStatement withTokens(List<SqlToken> newTokens) {
        return new OpenStatement(getOrdinal(), newTokens, cursorName, forQuery);
    }
}
