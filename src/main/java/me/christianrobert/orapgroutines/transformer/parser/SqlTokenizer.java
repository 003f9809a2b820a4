package me.christianrobert.orapgroutines.transformer.parser;

import me.christianrobert.orapgroutines.transformer.model.token.CursorAttribute;
import me.christianrobert.orapgroutines.transformer.model.token.SqlToken;
import me.christianrobert.orapgroutines.transformer.model.token.SqlTokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Splits comment-free PL/SQL source into tokens.
 *
 * <p>Dotted names ({@code emp_pkg.c1}, {@code r.ename}) form one WORD token, and so do
 * anchored types ({@code emp.sal%TYPE}). A name followed by {@code %ISOPEN},
 * {@code %FOUND}, {@code %NOTFOUND} or {@code %ROWCOUNT} becomes a single
 * ATTRIBUTE_REFERENCE token.
 *
 * <p><b>IMPORTANT:</b> Input must be comment-free (use CodeCleaner.removeComments first).
 */
public class SqlTokenizer {

    private static final Logger log = LoggerFactory.getLogger(SqlTokenizer.class);

    private static final Set<String> TWO_CHAR_SYMBOLS = Set.of(
            ":=", "||", "<<", ">>", "=>", "..", "<=", ">=", "<>", "!=", "^=", "**");

    private String source;
    private int position;

    public List<SqlToken> tokenize(String plsql) {
        this.source = plsql == null ? "" : plsql;
        this.position = 0;
        List<SqlToken> tokens = new ArrayList<>();

        while (position < source.length()) {
            char c = source.charAt(position);

            if (Character.isWhitespace(c)) {
                tokens.add(readWhitespace());
            } else if (isQuotedStringStart(c)) {
                tokens.add(readQuotedString());
            } else if (c == '\'') {
                tokens.add(readString(position));
            } else if (Character.isLetter(c) || c == '"') {
                tokens.add(readWordOrAttribute());
            } else if (Character.isDigit(c)) {
                tokens.add(readNumber());
            } else {
                tokens.add(readSymbol());
            }
        }

        log.trace("Tokenized {} chars into {} tokens", source.length(), tokens.size());
        return tokens;
    }

    private SqlToken readWhitespace() {
        int start = position;
        while (position < source.length() && Character.isWhitespace(source.charAt(position))) {
            position++;
        }
        return SqlToken.of(SqlTokenType.WHITESPACE, source.substring(start, position));
    }

    private SqlToken readString(int start) {
        // position is on the opening quote
        position++;
        while (position < source.length()) {
            char c = source.charAt(position);
            if (c == '\'') {
                if (position + 1 < source.length() && source.charAt(position + 1) == '\'') {
                    position += 2;
                    continue;
                }
                position++;
                return SqlToken.of(SqlTokenType.STRING, source.substring(start, position));
            }
            position++;
        }
        log.warn("Unterminated string literal starting at position {}", start);
        return SqlToken.of(SqlTokenType.STRING, source.substring(start));
    }

    /** q'[...]' style literal */
    private boolean isQuotedStringStart(char c) {
        return (c == 'q' || c == 'Q')
                && position + 2 < source.length()
                && source.charAt(position + 1) == '\'';
    }

    private SqlToken readQuotedString() {
        int start = position;
        char open = source.charAt(position + 2);
        char close = closingDelimiter(open);
        int search = position + 3;
        while (search + 1 < source.length()) {
            if (source.charAt(search) == close && source.charAt(search + 1) == '\'') {
                position = search + 2;
                return SqlToken.of(SqlTokenType.STRING, source.substring(start, position));
            }
            search++;
        }
        log.warn("Unterminated q-quoted literal starting at position {}", start);
        position = source.length();
        return SqlToken.of(SqlTokenType.STRING, source.substring(start));
    }

    private static char closingDelimiter(char open) {
        switch (open) {
            case '[':
                return ']';
            case '{':
                return '}';
            case '(':
                return ')';
            case '<':
                return '>';
            default:
                return open;
        }
    }

    private SqlToken readWordOrAttribute() {
        int start = position;
        readIdentifierPart();
        while (position + 1 < source.length()
                && source.charAt(position) == '.'
                && (Character.isLetter(source.charAt(position + 1)) || source.charAt(position + 1) == '"')) {
            position++;
            readIdentifierPart();
        }
        String name = source.substring(start, position);

        if (position + 1 < source.length() && source.charAt(position) == '%'
                && Character.isLetter(source.charAt(position + 1))) {
            int suffixStart = position + 1;
            int suffixEnd = suffixStart;
            while (suffixEnd < source.length() && isIdentifierChar(source.charAt(suffixEnd))) {
                suffixEnd++;
            }
            String suffix = source.substring(suffixStart, suffixEnd);
            position = suffixEnd;

            CursorAttribute attribute = CursorAttribute.fromSuffix(suffix);
            String text = source.substring(start, position);
            if (attribute != null) {
                return SqlToken.attributeReference(name, attribute, text);
            }
            return SqlToken.word(text);
        }

        return SqlToken.word(name);
    }

    private void readIdentifierPart() {
        if (source.charAt(position) == '"') {
            int closing = source.indexOf('"', position + 1);
            position = closing < 0 ? source.length() : closing + 1;
            return;
        }
        while (position < source.length() && isIdentifierChar(source.charAt(position))) {
            position++;
        }
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '#';
    }

    private SqlToken readNumber() {
        int start = position;
        while (position < source.length() && Character.isDigit(source.charAt(position))) {
            position++;
        }
        // a single dot followed by a digit is a decimal point, ".." is a range
        if (position + 1 < source.length() && source.charAt(position) == '.'
                && Character.isDigit(source.charAt(position + 1))) {
            position++;
            while (position < source.length() && Character.isDigit(source.charAt(position))) {
                position++;
            }
        }
        if (position + 1 < source.length()
                && (source.charAt(position) == 'e' || source.charAt(position) == 'E')
                && (Character.isDigit(source.charAt(position + 1)) || source.charAt(position + 1) == '-')) {
            position += 2;
            while (position < source.length() && Character.isDigit(source.charAt(position))) {
                position++;
            }
        }
        return SqlToken.of(SqlTokenType.NUMBER, source.substring(start, position));
    }

    private SqlToken readSymbol() {
        if (position + 1 < source.length()) {
            String pair = source.substring(position, position + 2);
            if (TWO_CHAR_SYMBOLS.contains(pair)) {
                position += 2;
                return SqlToken.symbol(pair);
            }
        }
        return SqlToken.symbol(String.valueOf(source.charAt(position++)));
    }
}
