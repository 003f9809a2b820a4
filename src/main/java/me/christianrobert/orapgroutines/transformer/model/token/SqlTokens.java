package me.christianrobert.orapgroutines.transformer.model.token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Helpers for token lists.
 */
public final class SqlTokens {

    private SqlTokens() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Returns the tokens without leading and trailing whitespace.
     */
    public static List<SqlToken> trim(List<SqlToken> tokens) {
        int start = 0;
        int end = tokens.size();
        while (start < end && tokens.get(start).isWhitespace()) {
            start++;
        }
        while (end > start && tokens.get(end - 1).isWhitespace()) {
            end--;
        }
        return new ArrayList<>(tokens.subList(start, end));
    }

    /**
     * Returns the non-whitespace tokens, for keyword inspection.
     */
    public static List<SqlToken> significant(List<SqlToken> tokens) {
        List<SqlToken> result = new ArrayList<>();
        for (SqlToken token : tokens) {
            if (!token.isWhitespace()) {
                result.add(token);
            }
        }
        return result;
    }

    /**
     * Wraps synthesized code as a single token. Used for injected statements that
     * never went through the tokenizer.
     */
    public static List<SqlToken> synthesized(String code) {
        return Collections.singletonList(SqlToken.of(SqlTokenType.SYMBOL, code));
    }

    public static List<SqlToken> immutableCopy(List<SqlToken> tokens) {
        return tokens == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(tokens));
    }
}
