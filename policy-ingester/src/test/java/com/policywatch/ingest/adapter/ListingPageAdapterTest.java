package com.policywatch.ingest.adapter;

import com.policywatch.ingest.config.IngesterProperties;
import com.policywatch.ingest.model.CandidateItem;
import com.policywatch.ingest.model.CrawlDepth;
import com.policywatch.ingest.model.CrawlMode;
import com.policywatch.ingest.model.Source;
import com.policywatch.ingest.resolve.FetchResult;
import com.policywatch.ingest.resolve.HttpFetcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ListingPageAdapterTest {

    private static final String LISTING = "https://example.gov/news/";

    @Mock
    private HttpFetcher fetcher;

    @InjectMocks
    private ListingPageAdapter adapter;

    private final Source source = Source.builder().id(7L).name("example_news").build();
    private IngesterProperties.SourceDefinition definition;

    @BeforeEach
    void setUp() {
        definition = new IngesterProperties.SourceDefinition();
        definition.setName("example_news");
        definition.setListingUrl(LISTING);
        definition.setPageUrlTemplate("https://example.gov/news/page/{page}/");
        definition.setLinkPattern("/\\d{4}/\\d{2}/\\d{2}/");
    }

    private static FetchResult html(String url, String body) {
        return FetchResult.ok(url, url, 200, "text/html; charset=utf-8", body.getBytes(StandardCharsets.UTF_8), null);
    }

    private static CrawlRequest depth(int pages) {
        return new CrawlRequest(CrawlMode.BACKFILL, new CrawlDepth(pages, Integer.MAX_VALUE));
    }

    @Test
    @DisplayName("Pages through the template until a 404, deduplicating links across pages")
    void pagesThroughTemplate() throws IOException {
        // given
        when(fetcher.fetch(LISTING)).thenReturn(html(LISTING, "<html><body>"
                + "<nav><a href=\"/about/\">About</a></nav>"
                + "<article><a href=\"/2024/01/05/governor-signs-bill/\">Governor signs bill</a>"
                + "<time datetime=\"2024-01-05T15:00:00Z\">Jan 5</time></article>"
                + "<article><a href=\"/2024/01/04/emergency-declared/?utm_source=home\">Emergency declared</a>"
                + "<span class=\"date\">January 4, 2024</span></article>"
                + "<a href=\"/2024/01/05/governor-signs-bill/#comments\">Comments</a>"
                + "</body></html>"));
        when(fetcher.fetch("https://example.gov/news/page/2/")).thenReturn(html("https://example.gov/news/page/2/",
                "<html><body><ul><li><a href=\"/2024/01/05/governor-signs-bill/\">Governor signs bill</a></li>"
                        + "<li><a href=\"/2024/01/03/budget-proposal/\">Budget proposal</a></li></ul></body></html>"));
        when(fetcher.fetch("https://example.gov/news/page/3/"))
                .thenReturn(FetchResult.permanentFailure("https://example.gov/news/page/3/", 404, "HTTP 404"));
        CandidatePager pager = adapter.open(source, definition, depth(10));

        // when
        List<CandidateItem> first = pager.nextBatch();
        List<CandidateItem> second = pager.nextBatch();
        List<CandidateItem> third = pager.nextBatch();

        // then
        assertThat(first).extracting(CandidateItem::externalId).containsExactly(
                "https://example.gov/2024/01/05/governor-signs-bill/",
                "https://example.gov/2024/01/04/emergency-declared/");
        assertThat(first.get(0).titleHint()).isEqualTo("Governor signs bill");
        assertThat(first.get(0).dateHint()).isEqualTo(OffsetDateTime.of(2024, 1, 5, 15, 0, 0, 0, ZoneOffset.UTC));
        assertThat(first.get(1).dateHint()).isEqualTo(OffsetDateTime.of(2024, 1, 4, 0, 0, 0, 0, ZoneOffset.UTC));
        assertThat(first.get(0).sourceId()).isEqualTo(7L);
        assertThat(second).extracting(CandidateItem::externalId)
                .containsExactly("https://example.gov/2024/01/03/budget-proposal/");
        assertThat(third).isEmpty();
        assertThat(pager.nextBatch()).isEmpty();
    }

    @Test
    @DisplayName("Follows rel=next links when no page template is configured")
    void followsNextLinks() throws IOException {
        // given
        String page1 = "https://governor.wa.gov/proclamations";
        String page2 = "https://governor.wa.gov/proclamations?page=1";
        definition.setListingUrl(page1);
        definition.setPageUrlTemplate(null);
        definition.setLinkPattern("/sites/default/files/.*\\.pdf$");
        when(fetcher.fetch(page1)).thenReturn(html(page1, "<html><body>"
                + "<a href=\"/sites/default/files/24-02 - Drought.pdf\">24-02</a>"
                + "<a href=\"/contact\">Contact</a>"
                + "<a rel=\"next\" href=\"/proclamations?page=1\">Next</a></body></html>"));
        when(fetcher.fetch(page2)).thenReturn(html(page2, "<html><body>"
                + "<a href=\"/sites/default/files/24-01 - December Storm.pdf\">24-01</a></body></html>"));
        CandidatePager pager = adapter.open(source, definition, depth(10));

        // when
        List<CandidateItem> first = pager.nextBatch();
        List<CandidateItem> second = pager.nextBatch();

        // then
        assertThat(first).extracting(CandidateItem::externalId)
                .containsExactly("https://governor.wa.gov/sites/default/files/24-02%20-%20Drought.pdf");
        assertThat(second).extracting(CandidateItem::externalId)
                .containsExactly("https://governor.wa.gov/sites/default/files/24-01%20-%20December%20Storm.pdf");
        assertThat(pager.nextBatch()).isEmpty();
        verify(fetcher, times(2)).fetch(anyString());
    }

    @Test
    @DisplayName("Never requests more pages than the crawl depth allows")
    void respectsPageBound() throws IOException {
        when(fetcher.fetch(LISTING)).thenReturn(html(LISTING,
                "<html><body><a href=\"/2024/01/05/a/\">A document title</a></body></html>"));
        CandidatePager pager = adapter.open(source, definition, depth(1));

        assertThat(pager.nextBatch()).hasSize(1);
        assertThat(pager.nextBatch()).isEmpty();
        verify(fetcher, times(1)).fetch(anyString());
    }

    @Test
    @DisplayName("An unreachable first page is reported as an I/O failure")
    void firstPageFailure() {
        when(fetcher.fetch(LISTING)).thenReturn(FetchResult.transientFailure(LISTING, 503, "HTTP 503"));
        CandidatePager pager = adapter.open(source, definition, depth(10));

        assertThatThrownBy(pager::nextBatch).isInstanceOf(IOException.class).hasMessageContaining("HTTP 503");
    }
}
