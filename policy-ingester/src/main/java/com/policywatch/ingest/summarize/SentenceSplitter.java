package com.policywatch.ingest.summarize;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Sentence segmentation for press releases and legal text.
 */
final class SentenceSplitter {

    static final int MIN_SENTENCE_LENGTH = 25;

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+(?=[A-Z0-9\"“])");
    private static final Pattern LINE_BREAKS = Pattern.compile("\\n+");
    private static final Pattern SENTENCE_ENDER = Pattern.compile("[.!?](?:\\s|$)");

    private static final Pattern BREADCRUMB = Pattern.compile(
            "(?i)^(?:briefings\\s*&\\s*statements|fact\\s*sheets|news|the white house|articles|home"
                    + "|skip to (?:main )?content|menu|share|print|search)\\b.*$");
    private static final Pattern TRAIL_SEPARATORS = Pattern.compile("\\s(?:>|»|/|›)\\s");

    private SentenceSplitter() {
    }

    /**
     * Punctuation-based split; texts with almost no sentence punctuation (scraped tables, lists of
     * headings) are split per line instead. Fragments shorter than {@link #MIN_SENTENCE_LENGTH} are dropped.
     */
    static List<String> split(String text) {
        String trimmed = text == null ? "" : text.strip();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        List<String> parts = new ArrayList<>();
        if (lowPunctuationDensity(trimmed)) {
            parts.addAll(List.of(LINE_BREAKS.split(trimmed)));
        } else {
            for (String paragraph : LINE_BREAKS.split(trimmed)) {
                parts.addAll(List.of(SENTENCE_BOUNDARY.split(paragraph.strip())));
            }
            if (parts.size() <= 1) {
                parts = new ArrayList<>(List.of(LINE_BREAKS.split(trimmed)));
            }
        }

        List<String> sentences = new ArrayList<>();
        for (String part : parts) {
            String s = part.replaceAll("\\s+", " ").strip();
            if (s.length() >= MIN_SENTENCE_LENGTH) {
                sentences.add(s);
            }
        }
        return sentences;
    }

    /** Removes navigation and breadcrumb lines */
    static String dropBoilerplateLines(String text) {
        StringBuilder out = new StringBuilder();
        for (String line : text.split("\\n")) {
            String l = line.strip();
            if (l.isEmpty() || isBoilerplate(l)) {
                continue;
            }
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append(l);
        }
        return out.toString();
    }

    static boolean isBoilerplate(String line) {
        if (line.length() > 120) {
            return false;
        }
        if (BREADCRUMB.matcher(line).matches()) {
            return true;
        }
        return TRAIL_SEPARATORS.matcher(line).find() && !SENTENCE_ENDER.matcher(line).find();
    }

    private static boolean lowPunctuationDensity(String text) {
        int lines = LINE_BREAKS.split(text).length;
        if (lines < 3) {
            return false;
        }
        long enders = SENTENCE_ENDER.matcher(text).results().count();
        return enders * 4 < lines;
    }
}
