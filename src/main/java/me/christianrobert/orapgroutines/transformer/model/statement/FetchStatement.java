package me.christianrobert.orapgroutines.transformer.model.statement;

import me.christianrobert.orapgroutines.transformer.model.token.SqlToken;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code FETCH cursor INTO target [, target ...];}
 */
public class FetchStatement extends PlSqlStatement {

    private final String cursorName;
    private final List<String> targets;

    public FetchStatement(int ordinal, List<SqlToken> tokens, String cursorName, List<String> targets) {
        super(ordinal, tokens);
        this.cursorName = cursorName;
        this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
    }

    public String getCursorName() {
        return cursorName;
    }

    public List<String> getTargets() {
        return targets;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.FETCH;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitFetch(this);
    }

    @Override
    public FetchStatement withTokens(List<SqlToken> newTokens) {
        return new FetchStatement(getOrdinal(), newTokens, cursorName, targets);
    }
}
