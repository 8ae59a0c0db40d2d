package com.policywatch.ingest.resolve;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Publication-date waterfall. Each step is tried in order; the first parse that is not in the
 * future (more than two days ahead of now) wins:
 *
 *  1. date supplied by the listing or feed
 *  2. structured metadata (Open Graph / itemprop / named meta tags / JSON-LD)
 *  3. machine-readable inline markup ({@code <time datetime>})
 *  4. URL path and filename patterns
 *  5. visible natural-language date near the top of the text
 *  6. signing clause at the end of orders and proclamations
 *  7. timestamp embedded in the document format
 *  8. Last-Modified response header
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PublicationDateExtractor {

    private static final Duration FUTURE_TOLERANCE = Duration.ofDays(2);
    private static final int VISIBLE_DATE_WINDOW = 1500;

    private static final List<String> META_SELECTORS = List.of(
            "meta[property=article:published_time]",
            "meta[property=og:published_time]",
            "meta[itemprop=datePublished]",
            "meta[name=publish-date]",
            "meta[name=publish_date]",
            "meta[name=pubdate]",
            "meta[name=date]",
            "meta[name=dc.date]",
            "meta[name=DC.date.issued]",
            "meta[name=citation_publication_date]");

    private static final List<String> JSON_LD_FIELDS = List.of("datePublished", "dateCreated", "dateModified");

    private static final Pattern URL_YMD = Pattern.compile("/((?:19|20)\\d{2})/(\\d{1,2})/(\\d{1,2})(?:/|$)");
    private static final Pattern URL_YM = Pattern.compile("/((?:19|20)\\d{2})/(\\d{1,2})(?:/|$)");
    private static final Pattern URL_COMPACT = Pattern.compile("(?:^|[/_-])(20\\d{2})[-_]?(\\d{2})[-_]?(\\d{2})(?=[-_.]|$)");
    private static final Pattern URL_FILING = Pattern.compile(
            "(?i)(?:^|[/_-])(?:eo|executive[-_]order|proclamation|order|ao)[-_]?(?:no[-_.]?)?(\\d{2})-(\\d{1,3})(?=[-_./]|$)");

    private static final String MONTH = "(January|February|March|April|May|June|July|August|September|October"
            + "|November|December|Jan\\.?|Feb\\.?|Mar\\.?|Apr\\.?|Jun\\.?|Jul\\.?|Aug\\.?|Sept?\\.?|Oct\\.?|Nov\\.?|Dec\\.?)";

    private static final Pattern VISIBLE_MONTH_DAY_YEAR = Pattern.compile(
            "(?i)\\b" + MONTH + "\\s+(\\d{1,2})(?:st|nd|rd|th)?,?\\s+((?:19|20)\\d{2})\\b");
    private static final Pattern VISIBLE_DAY_MONTH_YEAR = Pattern.compile(
            "(?i)\\b(\\d{1,2})(?:st|nd|rd|th)?\\s+" + MONTH + ",?\\s+((?:19|20)\\d{2})\\b");
    private static final Pattern VISIBLE_NUMERIC = Pattern.compile(
            "\\b(\\d{1,2})/(\\d{1,2})/((?:19|20)\\d{2})\\b");

    private final Clock clock;

    public Extracted<OffsetDateTime> extract(DateEvidence evidence) {
        OffsetDateTime limit = OffsetDateTime.now(clock).plus(FUTURE_TOLERANCE);

        Extracted<OffsetDateTime> found = accept(Optional.ofNullable(evidence.getExplicitDate()), "explicit", limit);
        if (found.isMiss() && evidence.getDocument() != null) {
            found = fromMetadata(evidence.getDocument(), limit);
        }
        if (found.isMiss() && evidence.getDocument() != null) {
            found = fromTimeElements(evidence.getDocument(), limit);
        }
        if (found.isMiss()) {
            found = fromUrl(evidence.getUrl(), limit);
        }
        if (found.isMiss()) {
            found = fromVisibleText(evidence.getText(), limit);
        }
        if (found.isMiss()) {
            found = accept(SigningClauseParser.parse(evidence.getText()), "signing-clause", limit);
        }
        if (found.isMiss()) {
            found = accept(Optional.ofNullable(evidence.getDocumentTimestamp()), "document-timestamp", limit);
        }
        if (found.isMiss()) {
            found = accept(Optional.ofNullable(evidence.getLastModified()), "last-modified", limit);
        }
        if (!found.isMiss()) {
            log.debug("Publication date {} from {} for {}", found.orElse(null), found.origin(), evidence.getUrl());
        }
        return found;
    }

    // ── Steps ────────────────────────────────────────────────────────────────

    private Extracted<OffsetDateTime> fromMetadata(Document doc, OffsetDateTime limit) {
        for (String selector : META_SELECTORS) {
            for (Element meta : doc.select(selector)) {
                Extracted<OffsetDateTime> hit = accept(DateParsing.parse(meta.attr("content")), "metadata", limit);
                if (!hit.isMiss()) {
                    return hit;
                }
            }
        }
        List<JsonNode> objects = HtmlText.jsonLdObjects(doc);
        for (String field : JSON_LD_FIELDS) {
            for (JsonNode node : objects) {
                JsonNode value = node.get(field);
                if (value != null && value.isTextual()) {
                    Extracted<OffsetDateTime> hit = accept(DateParsing.parse(value.asText()), "json-ld", limit);
                    if (!hit.isMiss()) {
                        return hit;
                    }
                }
            }
        }
        return Extracted.miss();
    }

    private Extracted<OffsetDateTime> fromTimeElements(Document doc, OffsetDateTime limit) {
        for (Element time : doc.select("time[datetime]")) {
            Extracted<OffsetDateTime> hit = accept(DateParsing.parse(time.attr("datetime")), "time-element", limit);
            if (!hit.isMiss()) {
                return hit;
            }
        }
        return Extracted.miss();
    }

    Extracted<OffsetDateTime> fromUrl(String url, OffsetDateTime limit) {
        if (url == null || url.isBlank()) {
            return Extracted.miss();
        }
        String path = url.replaceFirst("^[a-zA-Z]+://[^/]+", "").replaceFirst("[?#].*$", "");

        Matcher m = URL_YMD.matcher(path);
        if (m.find()) {
            Extracted<OffsetDateTime> hit = accept(DateParsing.ofDate(
                    Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3))),
                    "url-path", limit);
            if (!hit.isMiss()) {
                return hit;
            }
        }
        m = URL_YM.matcher(path);
        if (m.find()) {
            Extracted<OffsetDateTime> hit = accept(DateParsing.ofDate(
                    Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), 1), "url-path", limit);
            if (!hit.isMiss()) {
                return hit;
            }
        }

        String filename = path.substring(path.lastIndexOf('/') + 1);
        m = URL_COMPACT.matcher(filename);
        if (m.find()) {
            Extracted<OffsetDateTime> hit = accept(DateParsing.ofDate(
                    Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3))),
                    "url-filename", limit);
            if (!hit.isMiss()) {
                return hit;
            }
        }
        m = URL_FILING.matcher(filename);
        if (m.find()) {
            return accept(DateParsing.ofDate(2000 + Integer.parseInt(m.group(1)), 1, 1), "filing-number", limit);
        }
        return Extracted.miss();
    }

    Extracted<OffsetDateTime> fromVisibleText(String text, OffsetDateTime limit) {
        if (text == null || text.isBlank()) {
            return Extracted.miss();
        }
        String head = text.length() > VISIBLE_DATE_WINDOW ? text.substring(0, VISIBLE_DATE_WINDOW) : text;

        Matcher m = VISIBLE_MONTH_DAY_YEAR.matcher(head);
        while (m.find()) {
            Optional<Integer> month = DateParsing.month(m.group(1));
            if (month.isPresent()) {
                Extracted<OffsetDateTime> hit = accept(DateParsing.ofDate(
                        Integer.parseInt(m.group(3)), month.get(), Integer.parseInt(m.group(2))), "visible-text", limit);
                if (!hit.isMiss()) {
                    return hit;
                }
            }
        }
        m = VISIBLE_DAY_MONTH_YEAR.matcher(head);
        while (m.find()) {
            Optional<Integer> month = DateParsing.month(m.group(2));
            if (month.isPresent()) {
                Extracted<OffsetDateTime> hit = accept(DateParsing.ofDate(
                        Integer.parseInt(m.group(3)), month.get(), Integer.parseInt(m.group(1))), "visible-text", limit);
                if (!hit.isMiss()) {
                    return hit;
                }
            }
        }
        m = VISIBLE_NUMERIC.matcher(head);
        while (m.find()) {
            Extracted<OffsetDateTime> hit = accept(DateParsing.ofDate(Integer.parseInt(m.group(3)),
                    Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2))), "visible-text", limit);
            if (!hit.isMiss()) {
                return hit;
            }
        }
        return Extracted.miss();
    }

    private static Extracted<OffsetDateTime> accept(Optional<OffsetDateTime> candidate, String origin,
                                                    OffsetDateTime limit) {
        if (candidate.isEmpty()) {
            return Extracted.miss();
        }
        if (candidate.get().isAfter(limit)) {
            log.debug("Discarding future {} date {}", origin, candidate.get());
            return Extracted.miss();
        }
        return Extracted.of(candidate.get(), origin);
    }
}
