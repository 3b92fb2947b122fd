package com.example.hipagent.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalized text comparison used by the fuzzy extraction strategy.
 */
public final class TextSimilarity {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    private TextSimilarity() {
    }

    /**
     * Lower-cases, replaces punctuation with spaces and collapses whitespace.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    /**
     * Whether {@code phrase} occurs in {@code text} on word boundaries. Both arguments must
     * already be normalized.
     */
    public static boolean containsPhrase(String text, String phrase) {
        if (phrase.isEmpty() || text.length() < phrase.length()) {
            return false;
        }
        return (" " + text + " ").contains(" " + phrase + " ");
    }

    /**
     * 1 - levenshtein(a, b) / max(|a|, |b|). Two empty strings are identical.
     */
    public static double levenshteinRatio(String a, String b) {
        int longest = Math.max(a.length(), b.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(a, b) / longest;
    }

    /**
     * Upper bound of {@link #levenshteinRatio} from the lengths alone. Lets callers skip the
     * quadratic distance when it cannot reach a threshold.
     */
    public static double maxLevenshteinRatio(int lengthA, int lengthB) {
        int longest = Math.max(lengthA, lengthB);
        if (longest == 0) {
            return 1.0;
        }
        return (double) Math.min(lengthA, lengthB) / longest;
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                int cost = ca == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
