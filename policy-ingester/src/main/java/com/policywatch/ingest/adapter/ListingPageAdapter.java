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
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Paged HTML listings. Pages come from {@code pageUrlTemplate} when configured, otherwise by
 * following the page's rel=next link. Detail links are every anchor whose canonical URL matches
 * {@code linkPattern}, in document order, each URL at most once per run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ListingPageAdapter implements SourceAdapter {

    private static final String NEXT_LINK = "link[rel=next], a[rel=next], .pager__item--next a, "
            + ".pager-next a, a.next, .next a, .pagination-next a";
    private static final String ENTRY_CONTAINER = "article, li, tr, .views-row, .item, .card";

    private final HttpFetcher fetcher;

    @Override
    public AdapterType type() {
        return AdapterType.LISTING;
    }

    @Override
    public CandidatePager open(Source source, IngesterProperties.SourceDefinition definition, CrawlRequest request) {
        return new ListingPager(source, definition, request);
    }

    private class ListingPager implements CandidatePager {

        private final Source source;
        private final IngesterProperties.SourceDefinition definition;
        private final CrawlRequest request;
        private final Pattern linkPattern;
        private final Set<String> seen = new HashSet<>();
        private String nextUrl;
        private int pagesFetched;
        private boolean exhausted;

        ListingPager(Source source, IngesterProperties.SourceDefinition definition, CrawlRequest request) {
            this.source = source;
            this.definition = definition;
            this.request = request;
            this.linkPattern = definition.getLinkPattern() == null || definition.getLinkPattern().isBlank()
                    ? null : Pattern.compile(definition.getLinkPattern());
            this.nextUrl = definition.getListingUrl() != null ? definition.getListingUrl() : definition.getBaseUrl();
        }

        @Override
        public List<CandidateItem> nextBatch() throws IOException {
            if (exhausted || pagesFetched >= request.depth().maxPages() || nextUrl == null) {
                return List.of();
            }
            String pageUrl = nextUrl;
            FetchResult page = fetcher.fetch(pageUrl);
            pagesFetched++;

            if (!page.isOk()) {
                exhausted = true;
                if (pagesFetched > 1 && page.status() == 404) {
                    log.info("[{}] Listing ends at page {} ({} returned 404)", source.getName(), pagesFetched, pageUrl);
                    return List.of();
                }
                throw new IOException("Listing page " + pageUrl + " unavailable: " + page.error());
            }

            Document doc = Jsoup.parse(page.bodyAsString(), page.finalUrl());
            List<CandidateItem> batch = candidates(doc, page.finalUrl());
            nextUrl = followingPage(doc, page.finalUrl());
            if (batch.isEmpty()) {
                exhausted = true;
            }
            log.debug("[{}] Listing page {} yielded {} candidates", source.getName(), pagesFetched, batch.size());
            return batch;
        }

        private List<CandidateItem> candidates(Document doc, String pageUrl) {
            String listingCanonical = UrlCanonicalizer.canonicalize(pageUrl);
            String listingHost = host(pageUrl);
            List<CandidateItem> batch = new ArrayList<>();

            for (Element anchor : doc.select("a[href]")) {
                String url = UrlCanonicalizer.resolve(pageUrl, anchor.attr("href"));
                if (url == null || url.equals(listingCanonical) || !isDetailLink(url, listingHost)) {
                    continue;
                }
                if (!seen.add(url)) {
                    continue;
                }
                String title = anchor.text().trim();
                batch.add(new CandidateItem(source.getId(), url, title.isEmpty() ? null : title, dateNear(anchor)));
            }
            return batch;
        }

        private boolean isDetailLink(String url, String listingHost) {
            if (linkPattern != null) {
                return linkPattern.matcher(url).find();
            }
            return listingHost != null && listingHost.equals(host(url)) && !url.contains("/page/");
        }

        private String followingPage(Document doc, String pageUrl) {
            String template = definition.getPageUrlTemplate();
            if (template != null && !template.isBlank()) {
                int number = pagesFetched + 1 - 2 + definition.getTemplateStartPage();
                return template.replace("{page}", String.valueOf(number));
            }
            Element next = doc.selectFirst(NEXT_LINK);
            if (next == null) {
                return null;
            }
            String href = UrlCanonicalizer.resolve(pageUrl, next.attr("href"));
            return href == null || href.equals(UrlCanonicalizer.canonicalize(pageUrl)) ? null : href;
        }

        private OffsetDateTime dateNear(Element anchor) {
            Element container = anchor.closest(ENTRY_CONTAINER);
            if (container == null) {
                return null;
            }
            Element time = container.selectFirst("time[datetime]");
            if (time != null) {
                return DateParsing.parse(time.attr("datetime")).orElse(null);
            }
            Element dated = container.selectFirst("time, .date, .datetime, .date-display-single");
            return dated == null ? null : DateParsing.parse(dated.text()).orElse(null);
        }
    }

    private static String host(String url) {
        try {
            String host = URI.create(url).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
