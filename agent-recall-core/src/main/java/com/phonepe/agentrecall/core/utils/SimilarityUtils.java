package com.phonepe.agentrecall.core.utils;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.Sets;
import lombok.experimental.UtilityClass;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Similarity helpers used by the bundled stores to produce the semantic similarity signal
 */
@UtilityClass
public class SimilarityUtils {
    private static final Splitter WHITESPACE = Splitter.onPattern("\\s+").omitEmptyStrings().trimResults();

    /**
     * Cosine similarity between two vectors, clamped to [0,1]. Zero for mismatched or empty vectors.
     */
    public static double cosineSimilarity(float[] lhs, float[] rhs) {
        if (lhs == null || rhs == null || lhs.length == 0 || lhs.length != rhs.length) {
            return 0.0;
        }
        double dotProduct = 0.0;
        double normLhs = 0.0;
        double normRhs = 0.0;
        for (int i = 0; i < lhs.length; i++) {
            dotProduct += lhs[i] * rhs[i];
            normLhs += Math.pow(lhs[i], 2);
            normRhs += Math.pow(rhs[i], 2);
        }
        if (normLhs == 0.0 || normRhs == 0.0) {
            return 0.0;
        }
        return clamp(dotProduct / (Math.sqrt(normLhs) * Math.sqrt(normRhs)));
    }

    /**
     * Jaccard index over lower cased whitespace separated words
     */
    public static double textSimilarity(String lhs, String rhs) {
        if (Strings.isNullOrEmpty(lhs) || Strings.isNullOrEmpty(rhs)) {
            return 0.0;
        }
        return jaccard(words(lhs), words(rhs));
    }

    /**
     * |intersection| / |union|. Two empty sets are treated as identical.
     */
    public static <T> double jaccard(Set<T> lhs, Set<T> rhs) {
        final var union = Sets.union(lhs, rhs);
        if (union.isEmpty()) {
            return 1.0;
        }
        return (double) Sets.intersection(lhs, rhs).size() / union.size();
    }

    public static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static Set<String> words(String text) {
        return new HashSet<>(WHITESPACE.splitToList(text.toLowerCase(Locale.ROOT)));
    }
}
