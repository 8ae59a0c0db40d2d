package com.policywatch.ingest.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Recomputed at the start of every run from the persisted item count, never stored.
 */
public enum CrawlMode {

    /** Source owns zero items: honour the requested depth */
    BACKFILL("backfill"),

    /** Source already has items: bounded depth, only unseen candidates */
    INCREMENTAL("incremental");

    private final String label;

    CrawlMode(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static CrawlMode forItemCount(long persistedItems) {
        return persistedItems == 0 ? BACKFILL : INCREMENTAL;
    }
}
