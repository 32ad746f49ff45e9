package com.entity.linker.similarity;

import java.util.HashMap;
import java.util.Map;

/**
 * Cosine similarity between character n-gram count vectors.
 * Each word is padded with a space on both sides, so n-grams never span word boundaries.
 */
public class CharacterNGramCosineSimilarity implements SimilarityAlgorithm {

    private final int minN;
    private final int maxN;

    public CharacterNGramCosineSimilarity() {
        this(2, 3);
    }

    public CharacterNGramCosineSimilarity(int minN, int maxN) {
        if (minN < 1 || maxN < minN) {
            throw new IllegalArgumentException("n-gram range must satisfy 1 <= minN <= maxN");
        }
        this.minN = minN;
        this.maxN = maxN;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return s1.isBlank() ? 0.0 : 1.0;
        }
        Map<String, Integer> v1 = nGrams(s1);
        Map<String, Integer> v2 = nGrams(s2);
        if (v1.isEmpty() || v2.isEmpty()) {
            return 0.0;
        }

        double dot = 0.0;
        for (Map.Entry<String, Integer> e : v1.entrySet()) {
            Integer other = v2.get(e.getKey());
            if (other != null) {
                dot += (double) e.getValue() * other;
            }
        }
        double similarity = dot / (norm(v1) * norm(v2));
        return Math.min(1.0, similarity);
    }

    @Override
    public String name() {
        return "char-ngram-cosine";
    }

    private Map<String, Integer> nGrams(String s) {
        Map<String, Integer> counts = new HashMap<>();
        for (String word : s.strip().split("\\s+")) {
            if (word.isEmpty()) {
                continue;
            }
            String padded = " " + word + " ";
            for (int n = minN; n <= maxN; n++) {
                for (int i = 0; i + n <= padded.length(); i++) {
                    counts.merge(padded.substring(i, i + n), 1, Integer::sum);
                }
            }
        }
        return counts;
    }

    private static double norm(Map<String, Integer> vector) {
        double sum = 0.0;
        for (int count : vector.values()) {
            sum += (double) count * count;
        }
        return Math.sqrt(sum);
    }
}
