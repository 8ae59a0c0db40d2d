package com.policywatch.ingest.resolve;

import com.policywatch.ingest.config.IngesterProperties;
import com.policywatch.ingest.model.CandidateItem;
import com.policywatch.ingest.model.ContentRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContentResolverTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    @Mock
    private HttpFetcher fetcher;

    private ContentResolver resolver;
    private IngesterProperties.SourceDefinition source;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        resolver = new ContentResolver(fetcher, new TitleExtractor(), new PublicationDateExtractor(clock),
                List.of(new PlainTextExtractor()), clock);
        source = new IngesterProperties.SourceDefinition();
        source.setName("ca_newsroom");
        source.setSiteName("Governor of California");
    }

    @Test
    @DisplayName("HTML detail page resolves to a canonical id, title, date and main text")
    void resolvesHtmlPage() {
        // given
        String url = "https://www.gov.ca.gov/2024/03/05/governor-signs-water-bill/";
        String html = "<html><head><meta property=\"og:title\" content=\"Governor Signs Water Bill\">"
                + "<meta property=\"article:published_time\" content=\"2024-03-05T17:00:00Z\"></head>"
                + "<body><nav>Home | News</nav><article><p>SACRAMENTO - The Governor today signed legislation "
                + "that requires every water district to publish quarterly groundwater reports.</p></article>"
                + "</body></html>";
        when(fetcher.fetch(url)).thenReturn(FetchResult.ok(url, url + "?utm_source=rss#main", 200,
                "text/html; charset=utf-8", html.getBytes(StandardCharsets.UTF_8), null));

        // when
        Resolution resolution = resolver.resolve(new CandidateItem(1L, url, "Water bill", null), source);

        // then
        assertThat(resolution.isResolved()).isTrue();
        ContentRecord record = resolution.content();
        assertThat(record.getExternalId()).isEqualTo(url);
        assertThat(record.getTitle()).isEqualTo("Governor Signs Water Bill");
        assertThat(record.getPublishedAt()).isEqualTo(OffsetDateTime.of(2024, 3, 5, 17, 0, 0, 0, ZoneOffset.UTC));
        assertThat(record.getBodyText()).contains("requires every water district").doesNotContain("Home | News");
        assertThat(record.getFetchedAt().toInstant()).isEqualTo(NOW);
        assertThat(record.getHttpStatus()).isEqualTo(200);
    }

    @Test
    @DisplayName("Plain-text documents go through the document extractors")
    void resolvesPlainText() {
        String url = "https://example.gov/orders/eo-25-03.txt";
        when(fetcher.fetch(url)).thenReturn(FetchResult.ok(url, url, 200, "text/plain",
                "EXECUTIVE ORDER 25-03\nThe Governor directs all agencies to reduce energy use.".getBytes(StandardCharsets.UTF_8),
                null));

        Resolution resolution = resolver.resolve(new CandidateItem(1L, url, "Executive Order 25-03", null), source);

        assertThat(resolution.isResolved()).isTrue();
        assertThat(resolution.content().getTitle()).isEqualTo("Executive Order 25-03");
        assertThat(resolution.content().getPublishedAt())
                .isEqualTo(OffsetDateTime.of(2025, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Fetch failures and unsupported types resolve to a failure")
    void failures() {
        String missing = "https://example.gov/missing";
        String binary = "https://example.gov/file.bin";
        when(fetcher.fetch(missing)).thenReturn(FetchResult.permanentFailure(missing, 404, "HTTP 404"));
        when(fetcher.fetch(binary)).thenReturn(FetchResult.ok(binary, binary, 200, "application/octet-stream",
                new byte[]{1, 2, 3}, null));

        Resolution notFound = resolver.resolve(new CandidateItem(1L, missing, null, null), source);
        Resolution unsupported = resolver.resolve(new CandidateItem(1L, binary, null, null), source);

        assertThat(notFound.isResolved()).isFalse();
        assertThat(notFound.failure()).contains("404");
        assertThat(unsupported.isResolved()).isFalse();
        assertThat(unsupported.failure()).contains("application/octet-stream");
    }
}
