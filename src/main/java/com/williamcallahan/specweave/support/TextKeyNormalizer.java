package com.williamcallahan.specweave.support;

/**
 * Normalizes textual lookup keys (terms, operation names, production names).
 *
 * Keys compare case-sensitively; only whitespace is canonicalized so that a term
 * broken across source lines still matches its definition.
 */
public final class TextKeyNormalizer {

    private TextKeyNormalizer() {
        // Utility class - no instantiation
    }

    /**
     * Trims the text and collapses every whitespace run to a single space.
     *
     * @param text the raw key (may be null)
     * @return the normalized key, or empty string if null
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder normalized = new StringBuilder(text.length());
        boolean pendingSpace = false;
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            if (Character.isWhitespace(current) || current == '\u00A0') {
                pendingSpace = normalized.length() > 0;
                continue;
            }
            if (pendingSpace) {
                normalized.append(' ');
                pendingSpace = false;
            }
            normalized.append(current);
        }
        return normalized.toString();
    }

    /**
     * Lowercases the first character when it is an ASCII uppercase letter.
     *
     * Used for sentence-initial matches: "The realm" should find the term "the realm".
     *
     * @param key a normalized key
     * @return key with a lowercased initial
     */
    public static String lowerInitial(String key) {
        if (key == null || key.isEmpty()) {
            return "";
        }
        char first = key.charAt(0);
        if (first >= 'A' && first <= 'Z') {
            return (char) (first + ('a' - 'A')) + key.substring(1);
        }
        return key;
    }
}
