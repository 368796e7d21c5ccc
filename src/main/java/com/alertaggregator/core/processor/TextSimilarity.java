package com.alertaggregator.core.processor;

/**
 * Normalized string similarity based on the longest common subsequence.
 *
 * <p>{@code ratio(a, b) = 2 * LCS(a, b) / (|a| + |b|)}, in [0, 1]. Two empty strings are
 * identical (1.0); an empty string against a non-empty one scores 0.
 */
public final class TextSimilarity {

    private TextSimilarity() {}

    public static double ratio(String a, String b) {
        String left = a != null ? a : "";
        String right = b != null ? b : "";

        int total = left.length() + right.length();
        if (total == 0) {
            return 1.0;
        }
        if (left.equals(right)) {
            return 1.0;
        }
        return 2.0 * longestCommonSubsequence(left, right) / total;
    }

    /** Two-row dynamic programme, O(|a| * |b|) time and O(min(|a|, |b|)) space. */
    static int longestCommonSubsequence(String a, String b) {
        if (a.length() < b.length()) {
            String tmp = a;
            a = b;
            b = tmp;
        }
        if (b.isEmpty()) {
            return 0;
        }

        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];

        for (int i = 1; i <= a.length(); i++) {
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                if (ca == b.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
