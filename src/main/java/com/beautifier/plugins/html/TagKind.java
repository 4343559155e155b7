package com.beautifier.plugins.html;

import java.util.Locale;
import java.util.Set;

/**
 * How a captured tag affects nesting.
 */
public enum TagKind {
    OPENING,
    CLOSING,
    SELF_CLOSING,
    DECLARATION,
    COMMENT;

    /**
     * Classifies a tag body, the text between {@code <} and the closing {@code >}.
     */
    public static TagKind classify(String body, Set<String> voidElements) {
        if (body.startsWith("!--")) {
            return COMMENT;
        }
        if (body.startsWith("/")) {
            return CLOSING;
        }
        if (body.endsWith("/") || voidElements.contains(tagName(body))) {
            return SELF_CLOSING;
        }
        if (body.startsWith("!") || body.startsWith("?")) {
            return DECLARATION;
        }
        return OPENING;
    }

    /**
     * Lower-cased element name at the start of a tag body.
     */
    public static String tagName(String body) {
        int end = 0;
        while (end < body.length()) {
            char c = body.charAt(end);
            if (Character.isWhitespace(c) || c == '/' || c == '>') {
                break;
            }
            end++;
        }
        return body.substring(0, end).toLowerCase(Locale.ROOT);
    }
}
