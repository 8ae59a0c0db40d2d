package com.policywatch.ingest.sync;

public enum ItemOutcome {
    UPSERTED,
    RESOLVE_FAILED,
    STORE_FAILED,
    /** Unexpected error anywhere in the item pipeline */
    PROCESSING_FAILED
}
