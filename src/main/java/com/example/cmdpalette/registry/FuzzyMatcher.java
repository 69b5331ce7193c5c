package com.example.cmdpalette.registry;

/**
 * Subsequence matching: the query matches when all of its characters occur in
 * the text in order, ignoring case, with any gaps between them.
 */
public final class FuzzyMatcher {

    private FuzzyMatcher() {}

    public static boolean matches(String text, String query) {
        if (text == null || query == null) return false;
        int textIndex = 0;
        int queryIndex = 0;
        while (textIndex < text.length() && queryIndex < query.length()) {
            if (sameIgnoringCase(text.charAt(textIndex), query.charAt(queryIndex))) {
                queryIndex++;
            }
            textIndex++;
        }
        return queryIndex == query.length();
    }

    private static boolean sameIgnoringCase(char a, char b) {
        return a == b
                || Character.toLowerCase(a) == Character.toLowerCase(b)
                || Character.toUpperCase(a) == Character.toUpperCase(b);
    }
}
