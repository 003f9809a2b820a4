package me.christianrobert.orapgroutines.transformer.cursor;

import me.christianrobert.orapgroutines.transformer.model.token.CursorAttribute;

import java.util.Objects;

/**
 * One {@code cursor%ATTRIBUTE} occurrence, located by the ordinal of its statement.
 */
public class AttributeReferenceSite {

    private final int statementOrdinal;
    private final String cursorName;
    private final CursorAttribute attribute;

    public AttributeReferenceSite(int statementOrdinal, String cursorName, CursorAttribute attribute) {
        this.statementOrdinal = statementOrdinal;
        this.cursorName = cursorName;
        this.attribute = attribute;
    }

    public int getStatementOrdinal() {
        return statementOrdinal;
    }

    /** Cursor name as written, possibly package-qualified */
    public String getCursorName() {
        return cursorName;
    }

    public CursorAttribute getAttribute() {
        return attribute;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AttributeReferenceSite)) {
            return false;
        }
        AttributeReferenceSite other = (AttributeReferenceSite) o;
        return statementOrdinal == other.statementOrdinal
                && cursorName.equals(other.cursorName)
                && attribute == other.attribute;
    }

    @Override
    public int hashCode() {
        return Objects.hash(statementOrdinal, cursorName, attribute);
    }

    @Override
    public String toString() {
        return cursorName + "%" + attribute + " @" + statementOrdinal;
    }
}
