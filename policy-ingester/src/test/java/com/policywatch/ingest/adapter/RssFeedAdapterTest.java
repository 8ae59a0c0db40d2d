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
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RssFeedAdapterTest {

    private static final String FEED = "https://www.governor.ny.gov/news/rss.xml";

    @Mock
    private HttpFetcher fetcher;

    @InjectMocks
    private RssFeedAdapter adapter;

    private final Source source = Source.builder().id(3L).name("ny_news").build();
    private final CrawlRequest request = new CrawlRequest(CrawlMode.INCREMENTAL, new CrawlDepth(3, 25));
    private IngesterProperties.SourceDefinition definition;

    @BeforeEach
    void setUp() {
        definition = new IngesterProperties.SourceDefinition();
        definition.setName("ny_news");
        definition.setListingUrl(FEED);
    }

    private static FetchResult xml(String body) {
        return FetchResult.ok(FEED, FEED, 200, "application/rss+xml", body.getBytes(StandardCharsets.UTF_8), null);
    }

    @Test
    @DisplayName("RSS items become one batch in feed order, deduplicated by canonical link")
    void rssItems() throws IOException {
        // given
        when(fetcher.fetch(FEED)).thenReturn(xml("<?xml version=\"1.0\"?><rss version=\"2.0\"><channel>"
                + "<title>Governor Kathy Hochul</title><link>https://www.governor.ny.gov/news</link>"
                + "<item><title>Older item</title><link>https://www.governor.ny.gov/news/older?utm_source=rss</link>"
                + "<pubDate>Mon, 04 Mar 2024 10:00:00 GMT</pubDate></item>"
                + "<item><title>Newer item</title><link>https://www.governor.ny.gov/news/newer</link>"
                + "<pubDate>Tue, 05 Mar 2024 14:00:00 GMT</pubDate></item>"
                + "<item><title>Duplicate</title><link>https://www.governor.ny.gov/news/newer#top</link></item>"
                + "</channel></rss>"));
        CandidatePager pager = adapter.open(source, definition, request);

        // when
        List<CandidateItem> batch = pager.nextBatch();

        // then
        assertThat(batch).extracting(CandidateItem::externalId).containsExactly(
                "https://www.governor.ny.gov/news/older",
                "https://www.governor.ny.gov/news/newer");
        assertThat(batch.get(0).titleHint()).isEqualTo("Older item");
        assertThat(batch.get(0).dateHint()).isEqualTo(OffsetDateTime.of(2024, 3, 4, 10, 0, 0, 0, ZoneOffset.UTC));
        assertThat(pager.nextBatch()).isEmpty();
        assertThat(adapter.guaranteesOrder()).isFalse();
    }

    @Test
    @DisplayName("Atom entries use the alternate link and the updated date")
    void atomEntries() throws IOException {
        when(fetcher.fetch(FEED)).thenReturn(xml("<feed xmlns=\"http://www.w3.org/2005/Atom\"><title>Orders</title>"
                + "<entry><title>Order A</title><link rel=\"alternate\" href=\"https://example.gov/orders/a\"/>"
                + "<updated>2024-05-01T12:00:00Z</updated></entry></feed>"));

        List<CandidateItem> batch = adapter.open(source, definition, request).nextBatch();

        assertThat(batch).hasSize(1);
        assertThat(batch.get(0).externalId()).isEqualTo("https://example.gov/orders/a");
        assertThat(batch.get(0).dateHint()).isEqualTo(OffsetDateTime.of(2024, 5, 1, 12, 0, 0, 0, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Unreachable feed is an I/O failure")
    void feedFailure() {
        when(fetcher.fetch(FEED)).thenReturn(FetchResult.transientFailure(FEED, 502, "HTTP 502"));

        assertThatThrownBy(() -> adapter.open(source, definition, request).nextBatch())
                .isInstanceOf(IOException.class);
    }
}
