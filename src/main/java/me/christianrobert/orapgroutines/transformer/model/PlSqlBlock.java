package me.christianrobert.orapgroutines.transformer.model;

import me.christianrobert.orapgroutines.transformer.model.statement.PlSqlStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A declaration section plus a flat list of executable statements.
 *
 * <p>The routine body is the root block (id 0); nested blocks get increasing ids in
 * source order. The exception section is part of the statement list, introduced by an
 * {@code EXCEPTION} node.
 */
public class PlSqlBlock {

    public static final int ROOT_BLOCK_ID = 0;

    private final int blockId;
    private final List<Declaration> declarations;
    private final List<PlSqlStatement> statements;

    public PlSqlBlock(int blockId, List<Declaration> declarations, List<PlSqlStatement> statements) {
        this.blockId = blockId;
        this.declarations = Collections.unmodifiableList(new ArrayList<>(declarations));
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
    }

    public int getBlockId() {
        return blockId;
    }

    public boolean isRoot() {
        return blockId == ROOT_BLOCK_ID;
    }

    public List<Declaration> getDeclarations() {
        return declarations;
    }

    public List<PlSqlStatement> getStatements() {
        return statements;
    }

    @Override
    public String toString() {
        return "PlSqlBlock{id=" + blockId + ", declarations=" + declarations.size()
                + ", statements=" + statements.size() + "}";
    }
}
