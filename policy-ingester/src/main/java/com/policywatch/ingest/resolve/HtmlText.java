package com.policywatch.ingest.resolve;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * jsoup helpers: main-content text with paragraph breaks, and JSON-LD lookup.
 */
@Slf4j
public final class HtmlText {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static final Pattern MARKUP = Pattern.compile("<(?:[a-zA-Z][a-zA-Z0-9]*)(?:\\s[^>]*)?/?>");

    private static final Set<String> BLOCK_TAGS = Set.of(
            "p", "div", "section", "article", "main", "li", "ul", "ol", "tr", "table", "blockquote",
            "h1", "h2", "h3", "h4", "h5", "h6", "pre", "dd", "dt", "figcaption", "header", "footer");

    private static final String CHROME = "script, style, noscript, template, svg, iframe, form, nav, "
            + "header, footer, aside, .breadcrumb, .breadcrumbs, .share, .social, .skip-link, #skip-link";

    private static final String CONTENT_CANDIDATES = "article, main, [role=main], .entry-content, "
            + ".wp-block-post-content, .body-content, .page-content, .field--name-body, #content";

    private HtmlText() {
    }

    public static boolean looksLikeMarkup(String text) {
        return text != null && MARKUP.matcher(text).find();
    }

    /** Converts a markup fragment or document to text, keeping one line per block element */
    public static String toText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return mainText(Jsoup.parse(html));
    }

    /**
     * Text of the main content region. Navigation, scripts and page chrome are removed first;
     * the document passed in is not modified.
     */
    public static String mainText(Document document) {
        Document doc = document.clone();
        doc.select(CHROME).remove();

        Element root = null;
        for (Element candidate : doc.select(CONTENT_CANDIDATES)) {
            if (candidate.text().length() >= 200) {
                root = candidate;
                break;
            }
        }
        if (root == null) {
            root = doc.body() != null ? doc.body() : doc;
        }
        return blockText(root);
    }

    public static String blockText(Element root) {
        StringBuilder out = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode text) {
                    out.append(text.text());
                } else if (node instanceof Element el
                        && ("br".equals(el.normalName()) || BLOCK_TAGS.contains(el.normalName()))) {
                    out.append('\n');
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element el && BLOCK_TAGS.contains(el.normalName())) {
                    out.append('\n');
                }
            }
        }, root);
        return normalizeLines(out.toString());
    }

    /** Collapses runs of spaces, trims every line and drops empty ones */
    public static String normalizeLines(String text) {
        StringBuilder out = new StringBuilder();
        for (String line : text.replace('\u00A0', ' ').split("\\r?\\n")) {
            String cleaned = line.replaceAll("[ \\t\\x0B\\f]+", " ").strip();
            if (!cleaned.isEmpty()) {
                if (out.length() > 0) {
                    out.append('\n');
                }
                out.append(cleaned);
            }
        }
        return out.toString();
    }

    /** Every top-level object in the page's JSON-LD blocks, flattening arrays and @graph */
    public static List<JsonNode> jsonLdObjects(Document doc) {
        List<JsonNode> objects = new ArrayList<>();
        for (Element script : doc.select("script[type=application/ld+json]")) {
            try {
                collect(JSON.readTree(script.data()), objects);
            } catch (IOException e) {
                log.debug("Skipping unparseable JSON-LD block: {}", e.getMessage());
            }
        }
        return objects;
    }

    private static void collect(JsonNode node, List<JsonNode> into) {
        if (node == null) {
            return;
        }
        if (node.isArray()) {
            node.forEach(n -> collect(n, into));
        } else if (node.isObject()) {
            into.add(node);
            if (node.has("@graph")) {
                collect(node.get("@graph"), into);
            }
        }
    }
}
