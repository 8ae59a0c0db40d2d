package com.policywatch.ingest.resolve;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class PublicationDateExtractorTest {

    private PublicationDateExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new PublicationDateExtractor(Clock.fixed(Instant.parse("2025-06-01T00:00:00Z"), ZoneOffset.UTC));
    }

    private static OffsetDateTime day(int y, int m, int d) {
        return OffsetDateTime.of(y, m, d, 0, 0, 0, 0, ZoneOffset.UTC);
    }

    private static Document page(String head, String body) {
        return Jsoup.parse("<html><head>" + head + "</head><body>" + body + "</body></html>");
    }

    @Test
    @DisplayName("Listing date wins over page metadata")
    void explicitDateWins() {
        // given
        DateEvidence evidence = DateEvidence.builder()
                .explicitDate(day(2024, 1, 2))
                .document(page("<meta property=\"article:published_time\" content=\"2024-03-05\">", ""))
                .url("https://example.gov/news/item")
                .build();

        // when
        Extracted<OffsetDateTime> result = extractor.extract(evidence);

        // then
        assertThat(result.orElse(null)).isEqualTo(day(2024, 1, 2));
        assertThat(result.origin()).isEqualTo("explicit");
    }

    @Test
    @DisplayName("Open Graph published time is normalized to UTC")
    void metadata() {
        DateEvidence evidence = DateEvidence.builder()
                .document(page("<meta property=\"article:published_time\" content=\"2024-03-05T10:00:00-05:00\">", ""))
                .url("https://example.gov/news/item")
                .build();

        Extracted<OffsetDateTime> result = extractor.extract(evidence);

        assertThat(result.orElse(null)).isEqualTo(OffsetDateTime.of(2024, 3, 5, 15, 0, 0, 0, ZoneOffset.UTC));
        assertThat(result.origin()).isEqualTo("metadata");
    }

    @Test
    @DisplayName("JSON-LD datePublished is read when no meta tag is present")
    void jsonLd() {
        String ld = "<script type=\"application/ld+json\">{\"@context\":\"https://schema.org\","
                + "\"@graph\":[{\"@type\":\"NewsArticle\",\"datePublished\":\"2024-02-10\"}]}</script>";
        DateEvidence evidence = DateEvidence.builder().document(page(ld, "")).build();

        Extracted<OffsetDateTime> result = extractor.extract(evidence);

        assertThat(result.orElse(null)).isEqualTo(day(2024, 2, 10));
        assertThat(result.origin()).isEqualTo("json-ld");
    }

    @Test
    @DisplayName("time elements are used after metadata")
    void timeElement() {
        DateEvidence evidence = DateEvidence.builder()
                .document(page("", "<article><time datetime=\"2023-11-30\">Nov 30</time></article>"))
                .build();

        assertThat(extractor.extract(evidence).orElse(null)).isEqualTo(day(2023, 11, 30));
    }

    @Test
    @DisplayName("Future metadata dates are skipped and the URL date is used")
    void futureDateSkipped() {
        DateEvidence evidence = DateEvidence.builder()
                .document(page("<meta name=\"date\" content=\"2030-01-01\">", ""))
                .url("https://example.gov/2024/01/05/governor-signs-bill/")
                .build();

        Extracted<OffsetDateTime> result = extractor.extract(evidence);

        assertThat(result.orElse(null)).isEqualTo(day(2024, 1, 5));
        assertThat(result.origin()).isEqualTo("url-path");
    }

    @Test
    @DisplayName("URL year and month give the first of that month")
    void urlYearMonth() {
        OffsetDateTime limit = day(2025, 6, 3);

        assertThat(extractor.fromUrl("https://www.whitehouse.gov/presidential-actions/2025/01/some-order/", limit)
                .orElse(null)).isEqualTo(day(2025, 1, 1));
    }

    @Test
    @DisplayName("Compact dates and filing numbers in filenames")
    void urlFilenames() {
        OffsetDateTime limit = day(2025, 6, 3);

        assertThat(extractor.fromUrl("https://example.gov/files/20240822-order.pdf", limit).orElse(null))
                .isEqualTo(day(2024, 8, 22));
        Extracted<OffsetDateTime> filing = extractor.fromUrl(
                "https://governor.wa.gov/sites/default/files/proclamations/eo-25-03.pdf", limit);
        assertThat(filing.orElse(null)).isEqualTo(day(2025, 1, 1));
        assertThat(filing.origin()).isEqualTo("filing-number");
    }

    @Test
    @DisplayName("Visible dates near the top of the text")
    void visibleText() {
        DateEvidence evidence = DateEvidence.builder()
                .text("Released: March 3, 2025\nThe department today announced new guidance.")
                .url("https://example.gov/news/item")
                .build();

        Extracted<OffsetDateTime> result = extractor.extract(evidence);

        assertThat(result.orElse(null)).isEqualTo(day(2025, 3, 3));
        assertThat(result.origin()).isEqualTo("visible-text");
    }

    @Test
    @DisplayName("Signing clause is used when nothing earlier matched")
    void signingClause() {
        DateEvidence evidence = DateEvidence.builder()
                .text("NOW, THEREFORE, I do hereby proclaim a state of emergency.\n"
                        + "Signed and sealed this twelfth day of December, two thousand twenty-four.")
                .url("https://example.gov/proclamations/storm")
                .build();

        Extracted<OffsetDateTime> result = extractor.extract(evidence);

        assertThat(result.orElse(null)).isEqualTo(day(2024, 12, 12));
        assertThat(result.origin()).isEqualTo("signing-clause");
    }

    @Test
    @DisplayName("Document timestamp, then Last-Modified, are the last resorts")
    void fallbacks() {
        OffsetDateTime created = day(2024, 7, 1);
        OffsetDateTime modified = day(2024, 7, 9);

        assertThat(extractor.extract(DateEvidence.builder().documentTimestamp(created).lastModified(modified).build())
                .orElse(null)).isEqualTo(created);
        assertThat(extractor.extract(DateEvidence.builder().lastModified(modified).build()).origin())
                .isEqualTo("last-modified");
    }

    @Test
    @DisplayName("No evidence at all is a miss")
    void miss() {
        assertThat(extractor.extract(DateEvidence.builder().url("https://example.gov/about").build()).isMiss()).isTrue();
    }
}
