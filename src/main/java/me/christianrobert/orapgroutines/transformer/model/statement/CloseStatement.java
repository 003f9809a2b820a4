package me.christianrobert.orapgroutines.transformer.model.statement;

import me.christianrobert.orapgroutines.transformer.model.token.SqlToken;

import java.util.List;

/**
 * {@code CLOSE cursor;}
 */
public class CloseStatement extends PlSqlStatement {

    private final String cursorName;

    public CloseStatement(int ordinal, List<SqlToken> tokens, String cursorName) {
        super(ordinal, tokens);
        this.cursorName = cursorName;
    }

    public String getCursorName() {
        return cursorName;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.CLOSE;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitClose(this);
    }

    @Override
    public CloseStatement withTokens(List<SqlToken> newTokens) {
        return new CloseStatement(getOrdinal(), newTokens, cursorName);
    }
}
