package com.policywatch.ingest.sync;

import com.policywatch.ingest.config.IngesterProperties;
import com.policywatch.ingest.model.CandidateItem;
import com.policywatch.ingest.model.CatalogItem;
import com.policywatch.ingest.model.ContentRecord;
import com.policywatch.ingest.model.Source;
import com.policywatch.ingest.polish.PolishGate;
import com.policywatch.ingest.polish.PolishResult;
import com.policywatch.ingest.resolve.ContentResolver;
import com.policywatch.ingest.resolve.Resolution;
import com.policywatch.ingest.store.CatalogStore;
import com.policywatch.ingest.summarize.ExtractiveSummarizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

/**
 * One candidate through resolve, summarize, polish and upsert. Every failure stays inside this
 * item and is reported as an {@link ItemOutcome}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CandidateProcessor {

    private final ContentResolver resolver;
    private final ExtractiveSummarizer summarizer;
    private final PolishGate polishGate;
    private final CatalogStore store;

    public ItemOutcome process(CandidateItem candidate, Source source, IngesterProperties.SourceDefinition definition) {
        try {
            return resolveAndStore(candidate, source, definition);
        } catch (RuntimeException e) {
            log.error("[{}] Failed to process {}: {}", source.getName(), candidate.externalId(), e.getMessage(), e);
            return ItemOutcome.PROCESSING_FAILED;
        }
    }

    private ItemOutcome resolveAndStore(CandidateItem candidate, Source source,
                                        IngesterProperties.SourceDefinition definition) {
        Resolution resolution = resolver.resolve(candidate, definition);
        if (!resolution.isResolved()) {
            log.warn("[{}] Skipping {}: {}", source.getName(), candidate.externalId(), resolution.failure());
            return ItemOutcome.RESOLVE_FAILED;
        }
        ContentRecord content = resolution.content();

        String summary = summarizer.summarize(content.getBodyText());
        if (summary.isEmpty()) {
            summary = summarizer.firstParagraph(content.getBodyText());
        }
        PolishResult polished = polishGate.polish(summary, content.getTitle(), content.getExternalId());
        log.debug("[{}] Polish {} for {}", source.getName(), polished.outcome(), content.getExternalId());

        CatalogItem item = CatalogItem.builder()
                .sourceId(source.getId())
                .externalId(content.getExternalId())
                .entryId(candidate.externalId())
                .title(content.getTitle())
                .summary(polished.text())
                .url(content.getExternalId())
                .jurisdiction(definition.getJurisdiction())
                .agency(definition.getAgency())
                .status(definition.getStatus())
                .publishedAt(content.getPublishedAt())
                .fetchedAt(content.getFetchedAt())
                .build();

        try {
            store.upsert(item);
            return ItemOutcome.UPSERTED;
        } catch (DataAccessException | TransactionException e) {
            log.warn("[{}] Could not store {}: {}", source.getName(), item.getExternalId(), e.getMessage());
            return ItemOutcome.STORE_FAILED;
        }
    }
}
