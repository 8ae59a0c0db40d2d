package com.policywatch.ingest.resolve;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UrlCanonicalizerTest {

    @Test
    @DisplayName("Scheme and host are lower-cased, default port, fragment and tracking params dropped")
    void canonicalizes() {
        assertThat(UrlCanonicalizer.canonicalize(
                "HTTPS://WWW.Example.GOV:443/News/Item?utm_source=x&id=5&fbclid=abc#top"))
                .isEqualTo("https://www.example.gov/News/Item?id=5");
        assertThat(UrlCanonicalizer.canonicalize("http://example.gov:80")).isEqualTo("http://example.gov/");
        assertThat(UrlCanonicalizer.canonicalize("https://a.gov/x?utm_medium=email")).isEqualTo("https://a.gov/x");
    }

    @Test
    @DisplayName("Non-default ports, path case and meaningful params are kept")
    void keepsIdentityParts() {
        assertThat(UrlCanonicalizer.canonicalize("http://example.gov:8080/Docs/A.pdf?page=2"))
                .isEqualTo("http://example.gov:8080/Docs/A.pdf?page=2");
    }

    @Test
    @DisplayName("Query filtering keeps value-less flags and ignores tracking-name case")
    void filtersQueryParameters() {
        assertThat(UrlCanonicalizer.canonicalize("https://a.gov/search?flag&UTM_Campaign=z&q=storm%20relief&_ga=1"))
                .isEqualTo("https://a.gov/search?flag&q=storm%20relief");
        assertThat(UrlCanonicalizer.canonicalize("https://a.gov/eo?id=7&id=8")).isEqualTo("https://a.gov/eo?id=7&id=8");
    }

    @Test
    @DisplayName("A malformed port is kept as text and only the fragment is dropped")
    void malformedAuthority() {
        assertThat(UrlCanonicalizer.canonicalize("http://example.gov:port/a#b")).isEqualTo("http://example.gov:port/a");
    }

    @Test
    @DisplayName("Canonicalizing twice changes nothing")
    void idempotent() {
        String once = UrlCanonicalizer.canonicalize("HTTPS://Example.gov/a/?gclid=1&b=2#frag");

        assertThat(UrlCanonicalizer.canonicalize(once)).isEqualTo(once);
    }

    @Test
    @DisplayName("Relative hrefs resolve against the page; non-document hrefs are rejected")
    void resolvesRelativeLinks() {
        assertThat(UrlCanonicalizer.resolve("https://example.gov/news/", "../2024/01/05/item/#x"))
                .isEqualTo("https://example.gov/2024/01/05/item/");
        assertThat(UrlCanonicalizer.resolve("https://example.gov/news/", "mailto:press@example.gov")).isNull();
        assertThat(UrlCanonicalizer.resolve("https://example.gov/news/", "javascript:void(0)")).isNull();
        assertThat(UrlCanonicalizer.resolve("https://example.gov/news/", "#main")).isNull();
        assertThat(UrlCanonicalizer.resolve("https://example.gov/news/", "ftp://example.gov/file")).isNull();
    }

    @Test
    @DisplayName("Spaces in hrefs are encoded")
    void encodesSpaces() {
        assertThat(UrlCanonicalizer.resolve("https://governor.wa.gov/proclamations",
                "/sites/default/files/24-01 - December Storm.pdf"))
                .isEqualTo("https://governor.wa.gov/sites/default/files/24-01%20-%20December%20Storm.pdf");
    }
}
