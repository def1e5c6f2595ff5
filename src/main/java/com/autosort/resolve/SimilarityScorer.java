package com.autosort.resolve;

import java.util.Collection;
import java.util.Locale;

/**
 * Ratcliff/Obershelp string similarity: {@code 2 * matches / (len(a) + len(b))}, where matches
 * is the size of the longest common block plus, recursively, the matches to its left and right.
 * Comparison is case-insensitive so "documents" still snaps to "Documents".
 */
public final class SimilarityScorer {

    private SimilarityScorer() {
    }

    public static double ratio(String a, String b) {
        if (a == null || b == null) {
            return 0.0;
        }
        String x = a.toLowerCase(Locale.ROOT);
        String y = b.toLowerCase(Locale.ROOT);
        int total = x.length() + y.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matches(x, 0, x.length(), y, 0, y.length()) / total;
    }

    /**
     * Best-scoring candidate at or above {@code cutoff}, or null. Ties keep the earliest candidate.
     */
    public static String closestMatch(String word, Collection<String> candidates, double cutoff) {
        String best = null;
        double bestScore = -1;
        for (String candidate : candidates) {
            if (candidate == null) {
                continue;
            }
            double score = ratio(word, candidate);
            if (score >= cutoff && score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        return best;
    }

    private static int matches(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        if (aLo >= aHi || bLo >= bHi) {
            return 0;
        }
        int bestI = aLo;
        int bestJ = bLo;
        int bestSize = 0;
        // Dynamic programming over the current window for the longest common substring.
        int[] prev = new int[bHi - bLo + 1];
        for (int i = aLo; i < aHi; i++) {
            int[] cur = new int[bHi - bLo + 1];
            for (int j = bLo; j < bHi; j++) {
                if (a.charAt(i) == b.charAt(j)) {
                    int k = prev[j - bLo] + 1;
                    cur[j - bLo + 1] = k;
                    if (k > bestSize) {
                        bestSize = k;
                        bestI = i - k + 1;
                        bestJ = j - k + 1;
                    }
                }
            }
            prev = cur;
        }
        if (bestSize == 0) {
            return 0;
        }
        return bestSize
            + matches(a, aLo, bestI, b, bLo, bestJ)
            + matches(a, bestI + bestSize, aHi, b, bestJ + bestSize, bHi);
    }
}
