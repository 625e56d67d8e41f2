package com.oxypy.lang.python.lexer;

import java.util.Map;
import java.util.Set;

/**
 * Reserved words. Matching is exact and case-sensitive.
 */
public final class Keywords {

    private static final Map<String, TokenKind> KEYWORDS = Map.of(
            "if", TokenKind.IF,
            "else", TokenKind.ELSE
    );

    private Keywords() {
    }

    /**
     * @return the keyword kind spelled by {@code identifier}, or {@link TokenKind#NAME}
     */
    public static TokenKind lookup(String identifier) {
        return KEYWORDS.getOrDefault(identifier, TokenKind.NAME);
    }

    public static boolean isKeyword(String identifier) {
        return KEYWORDS.containsKey(identifier);
    }

    public static Set<String> spellings() {
        return KEYWORDS.keySet();
    }
}
