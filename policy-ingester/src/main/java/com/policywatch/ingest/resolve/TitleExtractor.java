package com.policywatch.ingest.resolve;

import com.fasterxml.jackson.databind.JsonNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Title waterfall. A candidate that is a known generic page title ("Home", "Newsroom", the site
 * name) never stops the waterfall.
 *
 *  1. Open Graph / Twitter card / JSON-LD headline
 *  2. the longest {@code <h1>}
 *  3. listing anchor text, then a non-markup document's embedded title
 *  4. {@code <title>} with the site-name suffix removed
 *  5. humanized last path segment of the URL
 */
@Component
public class TitleExtractor {

    private static final Set<String> GENERIC_TITLES = Set.of(
            "home", "homepage", "news", "newsroom", "news releases", "press releases", "press release",
            "menu", "main menu", "skip to content", "skip to main content", "the white house", "governor",
            "office of the governor", "search", "official website", "executive orders", "proclamations",
            "statements", "briefings & statements", "untitled", "untitled document", "page not found", "404");

    private static final Pattern TITLE_SUFFIX = Pattern.compile("\\s+[|\\-–—]\\s+");
    private static final Pattern FILE_EXTENSION = Pattern.compile("\\.(?:html?|php|aspx?|pdf|docx?|txt)$",
            Pattern.CASE_INSENSITIVE);

    public Extracted<String> extract(Document doc, String anchorHint, String url, String siteName) {
        return extract(doc, anchorHint, null, url, siteName);
    }

    /**
     * @param embeddedTitle title from a non-markup document's own metadata, tried after the anchor text
     */
    public Extracted<String> extract(Document doc, String anchorHint, String embeddedTitle, String url,
                                     String siteName) {
        if (doc != null) {
            for (String selector : List.of("meta[property=og:title]", "meta[name=twitter:title]",
                    "meta[property=twitter:title]")) {
                Element meta = doc.selectFirst(selector);
                if (meta != null && usable(meta.attr("content"), siteName)) {
                    return Extracted.of(clean(meta.attr("content")), "metadata");
                }
            }
            for (JsonNode node : HtmlText.jsonLdObjects(doc)) {
                JsonNode headline = node.get("headline");
                if (headline != null && headline.isTextual() && usable(headline.asText(), siteName)) {
                    return Extracted.of(clean(headline.asText()), "json-ld");
                }
            }

            String longestHeading = null;
            for (Element h1 : doc.select("h1")) {
                String text = clean(h1.text());
                if (usable(text, siteName) && (longestHeading == null || text.length() > longestHeading.length())) {
                    longestHeading = text;
                }
            }
            if (longestHeading != null) {
                return Extracted.of(longestHeading, "heading");
            }
        }

        if (usable(anchorHint, siteName)) {
            return Extracted.of(clean(anchorHint), "anchor");
        }
        if (usable(embeddedTitle, siteName)) {
            return Extracted.of(clean(embeddedTitle), "document-metadata");
        }

        if (doc != null) {
            String pageTitle = stripSiteSuffix(doc.title(), siteName);
            if (usable(pageTitle, siteName)) {
                return Extracted.of(pageTitle, "page-title");
            }
        }

        String slug = humanizeSlug(url);
        if (usable(slug, siteName)) {
            return Extracted.of(slug, "url-slug");
        }
        return Extracted.miss();
    }

    static String stripSiteSuffix(String title, String siteName) {
        String cleaned = clean(title);
        if (cleaned.isEmpty()) {
            return cleaned;
        }
        String[] parts = TITLE_SUFFIX.split(cleaned);
        if (parts.length == 1) {
            return cleaned;
        }
        if (siteName != null && !siteName.isBlank()) {
            String site = siteName.trim().toLowerCase(Locale.ROOT);
            List<String> kept = Arrays.stream(parts)
                    .filter(p -> !p.trim().toLowerCase(Locale.ROOT).equals(site))
                    .collect(Collectors.toList());
            if (!kept.isEmpty() && kept.size() < parts.length) {
                return kept.get(0).trim();
            }
        }
        return parts[0].trim();
    }

    static String humanizeSlug(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        String path = url.replaceFirst("^[a-zA-Z]+://[^/]+", "").replaceFirst("[?#].*$", "");
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        String segment = path.substring(path.lastIndexOf('/') + 1);
        segment = URLDecoder.decode(segment.replace("+", "%2B"), StandardCharsets.UTF_8);
        segment = FILE_EXTENSION.matcher(segment).replaceFirst("");
        String words = segment.replaceAll("[-_]+", " ").trim();
        if (words.isEmpty() || words.matches("\\d+")) {
            return "";
        }
        return Arrays.stream(words.split("\\s+"))
                .map(w -> w.isEmpty() ? w : Character.toUpperCase(w.charAt(0)) + w.substring(1))
                .collect(Collectors.joining(" "));
    }

    static boolean isGeneric(String title, String siteName) {
        String t = clean(title).toLowerCase(Locale.ROOT);
        if (GENERIC_TITLES.contains(t)) {
            return true;
        }
        return siteName != null && t.equals(siteName.trim().toLowerCase(Locale.ROOT));
    }

    private static boolean usable(String title, String siteName) {
        String cleaned = clean(title);
        return cleaned.length() >= 4 && !isGeneric(cleaned, siteName);
    }

    private static String clean(String text) {
        if (text == null) {
            return "";
        }
        return text.replace('\u00A0', ' ')
                .replace('‘', '\'').replace('’', '\'')
                .replace('“', '"').replace('”', '"')
                .replaceAll("\\s+", " ")
                .trim();
    }
}
