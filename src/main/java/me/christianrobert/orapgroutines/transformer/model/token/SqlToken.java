package me.christianrobert.orapgroutines.transformer.model.token;

import me.christianrobert.orapgroutines.core.tools.NameNormalizer;

import java.util.List;
import java.util.Objects;

/**
 * A single lexical token of a statement or declaration.
 *
 * <p>Attribute reference tokens carry the referenced cursor name exactly as written
 * (possibly package-qualified) and the attribute; their text is the original source
 * form, so an untranslated reference renders unchanged.
 */
public class SqlToken {

    private final SqlTokenType type;
    private final String text;
    private final String cursorName;
    private final CursorAttribute attribute;

    private SqlToken(SqlTokenType type, String text, String cursorName, CursorAttribute attribute) {
        this.type = Objects.requireNonNull(type, "type");
        this.text = Objects.requireNonNull(text, "text");
        this.cursorName = cursorName;
        this.attribute = attribute;
    }

    public static SqlToken of(SqlTokenType type, String text) {
        if (type == SqlTokenType.ATTRIBUTE_REFERENCE) {
            throw new IllegalArgumentException("Use attributeReference() for attribute tokens");
        }
        return new SqlToken(type, text, null, null);
    }

    public static SqlToken word(String text) {
        return new SqlToken(SqlTokenType.WORD, text, null, null);
    }

    public static SqlToken symbol(String text) {
        return new SqlToken(SqlTokenType.SYMBOL, text, null, null);
    }

    public static SqlToken space() {
        return new SqlToken(SqlTokenType.WHITESPACE, " ", null, null);
    }

    public static SqlToken attributeReference(String cursorName, CursorAttribute attribute, String text) {
        return new SqlToken(SqlTokenType.ATTRIBUTE_REFERENCE, text,
                Objects.requireNonNull(cursorName, "cursorName"),
                Objects.requireNonNull(attribute, "attribute"));
    }

    public SqlTokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public String getCursorName() {
        return cursorName;
    }

    public CursorAttribute getAttribute() {
        return attribute;
    }

    public boolean isWhitespace() {
        return type == SqlTokenType.WHITESPACE;
    }

    public boolean isAttributeReference() {
        return type == SqlTokenType.ATTRIBUTE_REFERENCE;
    }

    /**
     * Checks for a keyword or identifier, case-insensitively.
     */
    public boolean isWord(String word) {
        return type == SqlTokenType.WORD && NameNormalizer.sameIdentifier(text, word);
    }

    public boolean isSymbol(String symbol) {
        return type == SqlTokenType.SYMBOL && text.equals(symbol);
    }

    /**
     * Concatenates token texts (whitespace tokens included).
     */
    public static String join(List<SqlToken> tokens) {
        StringBuilder sb = new StringBuilder();
        for (SqlToken token : tokens) {
            sb.append(token.getText());
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SqlToken)) {
            return false;
        }
        SqlToken other = (SqlToken) o;
        return type == other.type && text.equals(other.text)
                && Objects.equals(cursorName, other.cursorName) && attribute == other.attribute;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, cursorName, attribute);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
