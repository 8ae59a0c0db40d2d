package com.policywatch.ingest.resolve;

import com.policywatch.ingest.config.IngesterProperties;
import com.policywatch.ingest.model.CandidateItem;
import com.policywatch.ingest.model.ContentRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Candidate in, {@link ContentRecord} out: fetch the detail URL, canonicalize the final URL,
 * extract text, title and publication date. Failures come back as {@link Resolution#failed}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ContentResolver {

    private final HttpFetcher fetcher;
    private final TitleExtractor titleExtractor;
    private final PublicationDateExtractor dateExtractor;
    private final List<DocumentTextExtractor> documentExtractors;
    private final Clock clock;

    public Resolution resolve(CandidateItem candidate, IngesterProperties.SourceDefinition source) {
        FetchResult fetched = fetcher.fetch(candidate.externalId());
        if (!fetched.isOk()) {
            return Resolution.failed(fetched.outcome() + ": " + fetched.error());
        }

        String canonical = UrlCanonicalizer.canonicalize(fetched.finalUrl());
        OffsetDateTime fetchedAt = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
        String siteName = source != null ? source.getSiteName() : null;

        if (fetched.isHtml()) {
            Document doc = Jsoup.parse(fetched.bodyAsString(), canonical);
            String text = HtmlText.mainText(doc);
            Extracted<String> title = titleExtractor.extract(doc, candidate.titleHint(), canonical, siteName);
            Extracted<OffsetDateTime> published = dateExtractor.extract(DateEvidence.builder()
                    .explicitDate(candidate.dateHint())
                    .document(doc)
                    .text(text)
                    .url(canonical)
                    .lastModified(fetched.lastModified())
                    .build());
            return Resolution.resolved(record(canonical, title, text, fetched, fetchedAt, published));
        }

        DocumentTextExtractor extractor = documentExtractors.stream()
                .filter(e -> e.supports(fetched.contentType(), canonical))
                .findFirst()
                .orElse(null);
        if (extractor == null) {
            return Resolution.failed("Unsupported content type " + fetched.contentType());
        }

        ExtractedDocument document;
        try {
            document = extractor.extract(fetched.body(), fetched.contentType());
        } catch (IOException e) {
            log.warn("Could not read {} ({}): {}", canonical, fetched.contentType(), e.getMessage());
            return Resolution.failed("Unreadable document: " + e.getMessage());
        }

        Extracted<String> title = titleExtractor.extract(null, candidate.titleHint(), document.title(),
                canonical, siteName);
        Extracted<OffsetDateTime> published = dateExtractor.extract(DateEvidence.builder()
                .explicitDate(candidate.dateHint())
                .text(document.text())
                .url(canonical)
                .documentTimestamp(document.timestamp())
                .lastModified(fetched.lastModified())
                .build());
        return Resolution.resolved(record(canonical, title, document.text(), fetched, fetchedAt, published));
    }

    private static ContentRecord record(String canonical, Extracted<String> title, String text, FetchResult fetched,
                                        OffsetDateTime fetchedAt, Extracted<OffsetDateTime> published) {
        return ContentRecord.builder()
                .externalId(canonical)
                .title(title.orElse(""))
                .bodyText(text)
                .contentType(fetched.contentType())
                .fetchedAt(fetchedAt)
                .httpStatus(fetched.status())
                .publishedAt(published.orElse(null))
                .build();
    }
}
