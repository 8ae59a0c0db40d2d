package com.policywatch.ingest.resolve;

/**
 * Raised inside a single attempt so the retry wrapper can try again. Never escapes {@link HttpFetcher}.
 */
public class TransientFetchException extends RuntimeException {

    private final int status;

    public TransientFetchException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
