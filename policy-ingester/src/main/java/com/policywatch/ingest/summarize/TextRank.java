package com.policywatch.ingest.summarize;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sentence centrality by power iteration over a cosine-similarity graph.
 * Bag-of-words vectors with a small stop list; no self-similarity; rows normalized to sum to one.
 */
final class TextRank {

    private static final Pattern WORD = Pattern.compile("[a-zA-Z0-9']+");

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "if", "while", "of", "to", "in", "on", "for",
            "is", "are", "was", "were", "be", "been", "it", "that", "this", "with", "as", "by",
            "at", "from", "we", "our", "their", "his", "her", "they", "them", "you", "your");

    private TextRank() {
    }

    static double[] rank(List<String> sentences, int iterations, double damping) {
        int n = sentences.size();
        if (n == 0) {
            return new double[0];
        }
        List<Map<String, Integer>> vectors = new ArrayList<>(n);
        for (String s : sentences) {
            vectors.add(termCounts(s));
        }

        double[][] weights = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double c = cosine(vectors.get(i), vectors.get(j));
                weights[i][j] = c;
                weights[j][i] = c;
            }
        }
        for (int i = 0; i < n; i++) {
            double rowSum = 0;
            for (int j = 0; j < n; j++) {
                rowSum += weights[i][j];
            }
            if (rowSum > 0) {
                for (int j = 0; j < n; j++) {
                    weights[i][j] /= rowSum;
                }
            }
        }

        double[] scores = new double[n];
        java.util.Arrays.fill(scores, 1.0 / n);
        double base = (1.0 - damping) / n;
        for (int iter = 0; iter < iterations; iter++) {
            double[] next = new double[n];
            for (int i = 0; i < n; i++) {
                double incoming = 0;
                for (int j = 0; j < n; j++) {
                    incoming += weights[j][i] * scores[j];
                }
                next[i] = base + damping * incoming;
            }
            scores = next;
        }
        return scores;
    }

    static Map<String, Integer> termCounts(String sentence) {
        Map<String, Integer> counts = new HashMap<>();
        Matcher m = WORD.matcher(sentence);
        while (m.find()) {
            String token = m.group().toLowerCase(Locale.ROOT);
            if (!STOP_WORDS.contains(token)) {
                counts.merge(token, 1, Integer::sum);
            }
        }
        return counts;
    }

    static double cosine(Map<String, Integer> a, Map<String, Integer> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        double dot = 0;
        for (Map.Entry<String, Integer> e : a.entrySet()) {
            Integer other = b.get(e.getKey());
            if (other != null) {
                dot += e.getValue() * other;
            }
        }
        double na = Math.sqrt(a.values().stream().mapToDouble(v -> v * v).sum());
        double nb = Math.sqrt(b.values().stream().mapToDouble(v -> v * v).sum());
        return na > 0 && nb > 0 ? dot / (na * nb) : 0.0;
    }
}
