package me.christianrobert.orapgroutines.transformer.model.token;

import java.util.Locale;

/**
 * Oracle cursor attributes that expose implicit cursor state.
 */
public enum CursorAttribute {
    ISOPEN,
    FOUND,
    NOTFOUND,
    ROWCOUNT;

    /**
     * Resolves the text after {@code %} (case-insensitive).
     *
     * @return the attribute, or null for anything else (%TYPE, %ROWTYPE, %BULK_ROWCOUNT)
     */
    public static CursorAttribute fromSuffix(String suffix) {
        if (suffix == null) {
            return null;
        }
        switch (suffix.toUpperCase(Locale.ROOT)) {
            case "ISOPEN":
                return ISOPEN;
            case "FOUND":
                return FOUND;
            case "NOTFOUND":
                return NOTFOUND;
            case "ROWCOUNT":
                return ROWCOUNT;
            default:
                return null;
        }
    }
}
