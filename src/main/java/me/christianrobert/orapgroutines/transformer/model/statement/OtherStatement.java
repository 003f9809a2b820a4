package me.christianrobert.orapgroutines.transformer.model.statement;

import me.christianrobert.orapgroutines.transformer.model.token.SqlToken;
import me.christianrobert.orapgroutines.transformer.model.token.SqlTokens;

import java.util.List;

/**
 * Any statement or control header without cursor semantics (assignments, calls,
 * IF/LOOP headers, RETURN, RAISE, ...). Passed through apart from attribute substitution.
 */
public class OtherStatement extends PlSqlStatement {

    private final ControlRole controlRole;

    public OtherStatement(int ordinal, List<SqlToken> tokens, ControlRole controlRole) {
        super(ordinal, tokens);
        this.controlRole = controlRole;
    }

    /**
     * Creates a statement that does not come from source (state transitions, diagnostics).
     */
    public static OtherStatement synthesized(String code) {
        return new OtherStatement(SYNTHESIZED, SqlTokens.synthesized(code), ControlRole.NONE);
    }

    public ControlRole getControlRole() {
        return controlRole;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.OTHER;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitOther(this);
    }

    @Override
    public OtherStatement withTokens(List<SqlToken> newTokens) {
        return new OtherStatement(getOrdinal(), newTokens, controlRole);
    }
}
