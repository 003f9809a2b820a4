package me.christianrobert.orapgroutines.transformer.model.statement;

import me.christianrobert.orapgroutines.transformer.model.PlSqlBlock;
import me.christianrobert.orapgroutines.transformer.model.token.SqlToken;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Nested {@code [DECLARE ...] BEGIN ... END;} block. Cursors declared inside are
 * scoped to it, and so is their shadow state.
 */
public class BlockStatement extends PlSqlStatement {

    private final PlSqlBlock block;

    public BlockStatement(int ordinal, PlSqlBlock block) {
        super(ordinal, Collections.emptyList());
        this.block = Objects.requireNonNull(block, "block");
    }

    public PlSqlBlock getBlock() {
        return block;
    }

    public BlockStatement withBlock(PlSqlBlock newBlock) {
        return new BlockStatement(getOrdinal(), newBlock);
    }

    @Override
    public String getText() {
        return "<block " + block.getBlockId() + ">";
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.BLOCK;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }

    @Override
    public BlockStatement withTokens(List<SqlToken> newTokens) {
        return this;
    }
}
