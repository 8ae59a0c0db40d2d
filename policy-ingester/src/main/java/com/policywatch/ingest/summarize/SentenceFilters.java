package com.policywatch.ingest.summarize;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Sentences that never belong in an extractive summary: quotations, list fragments, decorative
 * lines and the promotional openers newsrooms put in front of the actual announcement.
 */
final class SentenceFilters {

    private static final Pattern ATTRIBUTION = Pattern.compile("(?i)\\b(said|according to|stated|noted|added)\\b");
    private static final Pattern VOTERS_APPROVED = Pattern.compile("(?i)\\bin\\s20\\d\\d,\\s*voters approved\\b");
    private static final Pattern SIGNED_INTO_LAW = Pattern.compile("(?i)\\bhas signed into law\\b");
    private static final Pattern EMOJI = Pattern.compile(
            "[\\x{2600}-\\x{27BF}\\x{E000}-\\x{F8FF}\\x{1F300}-\\x{1FAFF}]");
    private static final Pattern QUANTITY = Pattern.compile(
            "(?i)(\\$[\\d,]+|\\b\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?\\b|\\b\\d+%|\\b(?:million|billion|thousand)\\b)");

    private static final String BULLET_MARKS = "•-–—✅✔▪►○●*·";

    private SentenceFilters() {
    }

    static boolean keep(String sentence) {
        return !isQuote(sentence) && !isBullet(sentence) && !isPromotional(sentence) && !isDecorative(sentence);
    }

    static boolean isQuote(String sentence) {
        String s = sentence.strip();
        if (s.startsWith("“") || s.startsWith("\"") || s.startsWith("'")) {
            return true;
        }
        if (s.contains("“") && ATTRIBUTION.matcher(s).find()) {
            return true;
        }
        return s.contains("“") && (s.endsWith("”") || s.endsWith("\""));
    }

    static boolean isBullet(String sentence) {
        String s = sentence.stripLeading();
        return !s.isEmpty() && BULLET_MARKS.indexOf(s.charAt(0)) >= 0;
    }

    static boolean isPromotional(String sentence) {
        String s = sentence.strip();
        String upper = s.toUpperCase(Locale.ROOT);
        return upper.startsWith("ICYMI")
                || upper.startsWith("WHAT YOU NEED TO KNOW")
                || VOTERS_APPROVED.matcher(s).find()
                || SIGNED_INTO_LAW.matcher(s).find();
    }

    static boolean isDecorative(String sentence) {
        if (EMOJI.matcher(sentence).find() && sentence.length() < 220) {
            return true;
        }
        long symbols = sentence.chars()
                .filter(c -> !Character.isLetterOrDigit(c) && !Character.isWhitespace(c))
                .count();
        return symbols > sentence.length() * 0.3;
    }

    static boolean hasQuantity(String sentence) {
        return QUANTITY.matcher(sentence).find();
    }
}
