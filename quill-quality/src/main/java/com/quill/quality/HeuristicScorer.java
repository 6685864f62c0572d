package com.quill.quality;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;

/**
 * Local readability heuristic on a 0-10 scale: rewards vocabulary diversity and moderate word
 * length, and penalizes texts shorter than {@link #MIN_WORDS} words.
 */
public final class HeuristicScorer implements QualityEvaluator {

    public static final int MIN_WORDS = 40;

    @Override
    public double score(String text) {
        List<String> words = words(text);
        if (words.isEmpty()) {
            return 0.0;
        }
        double totalLength = 0;
        for (String w : words) {
            totalLength += w.length();
        }
        double avgLen = totalLength / words.size();
        double vocabRatio = (double) new HashSet<>(words).size() / words.size();

        double score = 5 + (1.5 - Math.abs(1.5 - avgLen));
        score += vocabRatio * 5;
        score -= Math.max(0, (MIN_WORDS - words.size()) / (double) MIN_WORDS * 5);
        return QualityGate.clamp(score);
    }

    /** Whitespace-split words, lower-cased, with leading and trailing punctuation removed. */
    static List<String> words(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        for (String raw : text.trim().split("\\s+")) {
            String w = raw.replaceAll("^\\p{Punct}+|\\p{Punct}+$", "").toLowerCase(Locale.ROOT);
            if (!w.isEmpty()) {
                out.add(w);
            }
        }
        return out;
    }
}
