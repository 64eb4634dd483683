package com.goldminer.backend.services.sms.matching;

import java.util.Arrays;
import java.util.Locale;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * String similarity scores in the 0-100 range.
 *
 * <p>All scores derive from {@link #ratio(String, String)}, the normalized indel similarity
 * {@code 2 * LCS / (len(a) + len(b))}. Empty input on either side scores 0.
 */
public final class FuzzyScores {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");

    private FuzzyScores() {}

    public static int ratio(String a, String b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0;
        }
        int lcs = longestCommonSubsequence(a, b);
        return (int) Math.round(200.0 * lcs / (a.length() + b.length()));
    }

    /**
     * Best {@link #ratio} between the shorter string and every same-length window of the longer one.
     */
    public static int partialRatio(String a, String b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0;
        }
        String shorter = a.length() <= b.length() ? a : b;
        String longer = a.length() <= b.length() ? b : a;
        if (longer.contains(shorter)) {
            return 100;
        }
        int best = 0;
        int window = shorter.length();
        for (int start = 0; start + window <= longer.length(); start++) {
            int score = ratio(shorter, longer.substring(start, start + window));
            if (score > best) {
                best = score;
            }
        }
        return best;
    }

    /**
     * Ratio of both strings after their tokens are sorted, so word order does not matter.
     */
    public static int tokenSortRatio(String a, String b) {
        return ratio(sortedTokens(a), sortedTokens(b));
    }

    /**
     * Compares the shared tokens against each side's shared-plus-remaining tokens, so extra
     * words on one side ("carrefour maadi" vs "carrefour") do not lower the score.
     */
    public static int tokenSetRatio(String a, String b) {
        SortedSet<String> tokensA = tokenSet(a);
        SortedSet<String> tokensB = tokenSet(b);
        if (tokensA.isEmpty() || tokensB.isEmpty()) {
            return 0;
        }

        SortedSet<String> shared = new TreeSet<>(tokensA);
        shared.retainAll(tokensB);
        SortedSet<String> onlyA = new TreeSet<>(tokensA);
        onlyA.removeAll(tokensB);
        SortedSet<String> onlyB = new TreeSet<>(tokensB);
        onlyB.removeAll(tokensA);

        String sharedText = String.join(" ", shared);
        String combinedA = (sharedText + " " + String.join(" ", onlyA)).trim();
        String combinedB = (sharedText + " " + String.join(" ", onlyB)).trim();

        return Math.max(ratio(sharedText, combinedA),
                Math.max(ratio(sharedText, combinedB), ratio(combinedA, combinedB)));
    }

    /**
     * Lowercases and replaces every run of non letter/digit characters with a single space.
     */
    public static String preprocess(String value) {
        if (value == null) {
            return "";
        }
        return NON_ALPHANUMERIC.matcher(value.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    private static String sortedTokens(String value) {
        String processed = preprocess(value);
        if (processed.isEmpty()) {
            return "";
        }
        String[] tokens = processed.split(" ");
        Arrays.sort(tokens);
        return String.join(" ", tokens);
    }

    private static SortedSet<String> tokenSet(String value) {
        String processed = preprocess(value);
        SortedSet<String> tokens = new TreeSet<>();
        if (!processed.isEmpty()) {
            tokens.addAll(Arrays.asList(processed.split(" ")));
        }
        return tokens;
    }

    private static int longestCommonSubsequence(String a, String b) {
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
