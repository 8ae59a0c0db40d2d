package com.policywatch.ingest.resolve;

public enum FetchOutcome {
    OK,
    /** Timeouts, connection resets, 5xx and 429 after every attempt was used */
    TRANSIENT_FAILURE,
    /** 4xx other than 429, malformed URLs: never retried */
    PERMANENT_FAILURE
}
