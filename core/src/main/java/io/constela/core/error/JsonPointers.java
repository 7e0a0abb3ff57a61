package io.constela.core.error;

/**
 * Builds RFC 6901 JSON Pointer strings for error paths. The empty string addresses the whole
 * document.
 */
public final class JsonPointers {

    /** Pointer to the document root. */
    public static final String ROOT = "";

    private JsonPointers() {}

    /** Appends one reference token, escaping {@code ~} and {@code /}. */
    public static String append(String base, String token) {
        return base + "/" + escape(token);
    }

    /** Appends several reference tokens in order. */
    public static String append(String base, String... tokens) {
        String result = base;
        for (String token : tokens) {
            result = append(result, token);
        }
        return result;
    }

    public static String append(String base, int index) {
        return base + "/" + index;
    }

    static String escape(String token) {
        if (token.indexOf('~') < 0 && token.indexOf('/') < 0) {
            return token;
        }
        return token.replace("~", "~0").replace("/", "~1");
    }
}
