package com.policywatch.ingest.adapter;

import com.policywatch.ingest.config.IngesterProperties;
import com.policywatch.ingest.model.CandidateItem;
import com.policywatch.ingest.model.Source;
import com.policywatch.ingest.resolve.DateParsing;
import com.policywatch.ingest.resolve.FetchResult;
import com.policywatch.ingest.resolve.HttpFetcher;
import com.policywatch.ingest.resolve.UrlCanonicalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * RSS 2.0 and Atom feeds. A feed is a single batch in feed order, which feeds do not promise to be
 * newest first.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RssFeedAdapter implements SourceAdapter {

    private final HttpFetcher fetcher;

    @Override
    public AdapterType type() {
        return AdapterType.RSS;
    }

    @Override
    public boolean guaranteesOrder() {
        return false;
    }

    @Override
    public CandidatePager open(Source source, IngesterProperties.SourceDefinition definition, CrawlRequest request) {
        return new CandidatePager() {
            private boolean done;

            @Override
            public List<CandidateItem> nextBatch() throws IOException {
                if (done || request.depth().maxPages() < 1) {
                    return List.of();
                }
                done = true;
                return readFeed(source, definition);
            }
        };
    }

    List<CandidateItem> readFeed(Source source, IngesterProperties.SourceDefinition definition) throws IOException {
        String feedUrl = definition.getListingUrl() != null ? definition.getListingUrl() : definition.getBaseUrl();
        FetchResult feed = fetcher.fetch(feedUrl);
        if (!feed.isOk()) {
            throw new IOException("Feed " + feedUrl + " unavailable: " + feed.error());
        }

        Pattern linkPattern = definition.getLinkPattern() == null || definition.getLinkPattern().isBlank()
                ? null : Pattern.compile(definition.getLinkPattern());
        Document doc = Jsoup.parse(feed.bodyAsString(), feed.finalUrl(), Parser.xmlParser());

        Map<String, CandidateItem> entries = new LinkedHashMap<>();
        for (Element item : doc.select("item, entry")) {
            String url = UrlCanonicalizer.resolve(feed.finalUrl(), link(item));
            if (url == null || (linkPattern != null && !linkPattern.matcher(url).find())) {
                continue;
            }
            Element title = item.selectFirst("title");
            entries.putIfAbsent(url, new CandidateItem(
                    source.getId(),
                    url,
                    title == null || title.text().isBlank() ? null : title.text().trim(),
                    date(item)));
        }

        List<CandidateItem> batch = new ArrayList<>(entries.values());
        log.debug("[{}] Feed yielded {} entries", source.getName(), batch.size());
        return batch;
    }

    private static String link(Element item) {
        Element alternate = item.selectFirst("link[rel=alternate][href]");
        if (alternate != null) {
            return alternate.attr("href");
        }
        Element link = item.selectFirst("link");
        if (link == null) {
            Element guid = item.selectFirst("guid");
            return guid == null ? null : guid.text();
        }
        return link.hasAttr("href") ? link.attr("href") : link.text();
    }

    private static OffsetDateTime date(Element item) {
        for (String tag : new String[]{"pubDate", "published", "updated", "dc|date"}) {
            Element el = item.selectFirst(tag);
            if (el != null) {
                OffsetDateTime parsed = DateParsing.parse(el.text()).orElse(null);
                if (parsed != null) {
                    return parsed;
                }
            }
        }
        return null;
    }
}
