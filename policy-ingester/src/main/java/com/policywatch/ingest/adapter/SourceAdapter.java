package com.policywatch.ingest.adapter;

import com.policywatch.ingest.config.IngesterProperties;
import com.policywatch.ingest.model.Source;

/**
 * Knows how one family of sources publishes its catalog. Only discovery lives here; detail
 * fetching belongs to the content resolver.
 */
public interface SourceAdapter {

    AdapterType type();

    CandidatePager open(Source source, IngesterProperties.SourceDefinition definition, CrawlRequest request);

    /**
     * Whether batches arrive newest first. When false the caller re-sorts each batch by date hint
     * before looking for the cutoff.
     */
    default boolean guaranteesOrder() {
        return true;
    }
}
