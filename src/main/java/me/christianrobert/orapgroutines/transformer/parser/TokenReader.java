package me.christianrobert.orapgroutines.transformer.parser;

import me.christianrobert.orapgroutines.transformer.model.token.SqlToken;

import java.util.ArrayList;
import java.util.List;

/**
 * Forward-only reader over a token list. Lookahead skips whitespace; slices keep it.
 */
final class TokenReader {

    private final List<SqlToken> tokens;
    private int position;

    TokenReader(List<SqlToken> tokens) {
        this.tokens = tokens;
        this.position = 0;
    }

    int position() {
        return position;
    }

    void reset(int newPosition) {
        this.position = newPosition;
    }

    int size() {
        return tokens.size();
    }

    SqlToken tokenAt(int index) {
        return tokens.get(index);
    }

    void skipWhitespace() {
        while (position < tokens.size() && tokens.get(position).isWhitespace()) {
            position++;
        }
    }

    /** True when only whitespace is left */
    boolean atEnd() {
        return indexOfSignificant(0) < 0;
    }

    /** Next significant token without consuming it, null at the end */
    SqlToken peek() {
        return peek(0);
    }

    /** The k-th significant token ahead (0 = next), null when there are fewer */
    SqlToken peek(int ahead) {
        int index = indexOfSignificant(ahead);
        return index < 0 ? null : tokens.get(index);
    }

    boolean peekWord(String... words) {
        SqlToken next = peek();
        if (next == null) {
            return false;
        }
        for (String word : words) {
            if (next.isWord(word)) {
                return true;
            }
        }
        return false;
    }

    boolean peekSymbol(String symbol) {
        SqlToken next = peek();
        return next != null && next.isSymbol(symbol);
    }

    /** Consumes up to and including the next significant token */
    SqlToken next() {
        int index = indexOfSignificant(0);
        if (index < 0) {
            position = tokens.size();
            return null;
        }
        position = index + 1;
        return tokens.get(index);
    }

    List<SqlToken> slice(int from, int to) {
        return new ArrayList<>(tokens.subList(from, to));
    }

    private int indexOfSignificant(int ahead) {
        int seen = 0;
        for (int i = position; i < tokens.size(); i++) {
            if (tokens.get(i).isWhitespace()) {
                continue;
            }
            if (seen == ahead) {
                return i;
            }
            seen++;
        }
        return -1;
    }
}
