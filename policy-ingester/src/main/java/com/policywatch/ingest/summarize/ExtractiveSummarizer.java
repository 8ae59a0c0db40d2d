package com.policywatch.ingest.summarize;

import com.policywatch.ingest.config.IngesterProperties;
import com.policywatch.ingest.resolve.HtmlText;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Deterministic, offline extractive summarizer.
 *
 * Short texts and enacting-clause documents (executive orders and the like) use a keyword score:
 * policy-action verb, then quantitative content, then length, then position. Everything else is
 * ranked by TextRank. In both modes the chosen sentences are emitted in their original order.
 */
@Component
public class ExtractiveSummarizer {

    static final String ELLIPSIS = "…";

    private static final Pattern ENACTING_PREAMBLE = Pattern.compile(
            "(?is)by the authority vested in me.*?it is hereby ordered\\s*:?");
    private static final int PREAMBLE_WINDOW = 1000;

    private static final List<String> ACTION_VERBS = List.of(
            "directs", "orders", "establishes", "requires", "designates", "amends", "revokes",
            "implements", "authorizes", "prohibits");

    private static final int FALLBACK_PARAGRAPH_MIN = 60;

    private final IngesterProperties.Summary settings;

    public ExtractiveSummarizer(IngesterProperties properties) {
        this.settings = properties.getSummary();
    }

    public String summarize(String content) {
        return summarize(content, settings.getMaxSentences(), settings.getMaxChars());
    }

    public String summarize(String content, int maxSentences, int maxChars) {
        if (content == null || content.isBlank() || maxSentences < 1 || maxChars < 1) {
            return "";
        }
        String text = HtmlText.looksLikeMarkup(content) ? HtmlText.toText(content) : content;
        if (text.length() > settings.getMaxInputChars()) {
            text = text.substring(0, settings.getMaxInputChars());
        }
        text = SentenceSplitter.dropBoilerplateLines(text);

        Matcher preamble = ENACTING_PREAMBLE.matcher(text);
        boolean enacting = preamble.find() && preamble.start() < PREAMBLE_WINDOW;
        if (enacting) {
            text = (text.substring(0, preamble.start()) + " " + text.substring(preamble.end())).strip();
        }

        List<String> sentences = SentenceSplitter.split(text).stream()
                .filter(SentenceFilters::keep)
                .collect(Collectors.toList());
        if (sentences.isEmpty()) {
            return "";
        }

        List<Integer> chosen = enacting || sentences.size() <= settings.getShortTextSentences()
                ? keywordPick(sentences, maxSentences)
                : rankPick(sentences, maxSentences);

        String joined = chosen.stream()
                .sorted()
                .map(sentences::get)
                .collect(Collectors.joining(" "))
                .replaceAll("\\s+", " ")
                .strip();
        return truncate(CapsNormalizer.normalize(joined), maxChars);
    }

    /**
     * Used when {@link #summarize} produced nothing: the first paragraph long enough to say
     * something, cut to the character budget.
     */
    public String firstParagraph(String content) {
        if (content == null || content.isBlank()) {
            return "";
        }
        String text = HtmlText.looksLikeMarkup(content) ? HtmlText.toText(content) : content;
        for (String paragraph : SentenceSplitter.dropBoilerplateLines(text).split("\\n")) {
            String p = paragraph.replaceAll("\\s+", " ").strip();
            if (p.length() > FALLBACK_PARAGRAPH_MIN) {
                return truncate(p, settings.getMaxChars());
            }
        }
        return "";
    }

    // ── Selection ────────────────────────────────────────────────────────────

    private static List<Integer> keywordPick(List<String> sentences, int k) {
        Comparator<Integer> byScore = Comparator
                .<Integer>comparingInt(i -> hasActionVerb(sentences.get(i)) ? 1 : 0)
                .thenComparingInt(i -> SentenceFilters.hasQuantity(sentences.get(i)) ? 1 : 0)
                .thenComparingInt(i -> sentences.get(i).length())
                .reversed()
                .thenComparingInt(i -> i);
        return IntStream.range(0, sentences.size()).boxed()
                .sorted(byScore)
                .limit(k)
                .collect(Collectors.toList());
    }

    private List<Integer> rankPick(List<String> sentences, int k) {
        double[] scores = TextRank.rank(sentences, settings.getTextrankIterations(), settings.getDamping());
        Comparator<Integer> byScore = Comparator
                .<Integer>comparingDouble(i -> scores[i])
                .reversed()
                .thenComparingInt(i -> i);
        return IntStream.range(0, sentences.size()).boxed()
                .sorted(byScore)
                .limit(k)
                .collect(Collectors.toList());
    }

    private static boolean hasActionVerb(String sentence) {
        String lower = sentence.toLowerCase(Locale.ROOT);
        return ACTION_VERBS.stream().anyMatch(lower::contains);
    }

    // ── Output ───────────────────────────────────────────────────────────────

    /** Cuts at the last whole word so that the result, ellipsis included, fits in {@code maxChars} */
    static String truncate(String text, int maxChars) {
        if (text.length() <= maxChars) {
            return text;
        }
        String cut = text.substring(0, Math.max(0, maxChars - ELLIPSIS.length()));
        int lastSpace = cut.lastIndexOf(' ');
        if (lastSpace > 0) {
            cut = cut.substring(0, lastSpace);
        }
        int end = cut.length();
        while (end > 0 && " .,;:".indexOf(cut.charAt(end - 1)) >= 0) {
            end--;
        }
        return cut.substring(0, end) + ELLIPSIS;
    }
}
