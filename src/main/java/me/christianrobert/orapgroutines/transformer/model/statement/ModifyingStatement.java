package me.christianrobert.orapgroutines.transformer.model.statement;

import me.christianrobert.orapgroutines.transformer.model.token.SqlToken;

import java.util.List;

/**
 * DML or SELECT INTO; refreshes the routine's last row count when it is tracked.
 */
public class ModifyingStatement extends PlSqlStatement {

    private final ModificationKind modificationKind;

    public ModifyingStatement(int ordinal, List<SqlToken> tokens, ModificationKind modificationKind) {
        super(ordinal, tokens);
        this.modificationKind = modificationKind;
    }

    public ModificationKind getModificationKind() {
        return modificationKind;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.MODIFYING;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitModifying(this);
    }

    @Override
    public ModifyingStatement withTokens(List<SqlToken> newTokens) {
        return new ModifyingStatement(getOrdinal(), newTokens, modificationKind);
    }
}
