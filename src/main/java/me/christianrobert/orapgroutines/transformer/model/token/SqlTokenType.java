package me.christianrobert.orapgroutines.transformer.model.token;

/**
 * Lexical categories produced by the source tokenizer.
 */
public enum SqlTokenType {
    /** Identifier or keyword, possibly dotted (e.g. {@code emp_pkg.c1}) or quoted */
    WORD,
    /** Single-quoted string literal including the quotes */
    STRING,
    NUMBER,
    /** Operators and punctuation, multi-character operators as one token (:=, ||, <<, >>, =>, ..) */
    SYMBOL,
    WHITESPACE,
    /** {@code cursor%ISOPEN}, {@code cursor%FOUND}, {@code cursor%NOTFOUND}, {@code cursor%ROWCOUNT} */
    ATTRIBUTE_REFERENCE
}
