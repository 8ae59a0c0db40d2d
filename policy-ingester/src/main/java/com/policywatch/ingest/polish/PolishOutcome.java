package com.policywatch.ingest.polish;

public enum PolishOutcome {
    POLISHED,
    SKIPPED_EMPTY,
    SKIPPED_NO_PROVIDER,
    SKIPPED_BUDGET,
    /** Polish executor refused the call; nothing was sent and nothing counted */
    SKIPPED_BUSY,
    /** Provider error or timeout; the call still counted against the budget */
    FAILED,
    /** Provider answered with something too short to be a summary */
    REJECTED_SHORT
}
