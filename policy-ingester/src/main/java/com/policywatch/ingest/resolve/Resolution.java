package com.policywatch.ingest.resolve;

import com.policywatch.ingest.model.ContentRecord;

/**
 * Either a resolved {@link ContentRecord} or the reason resolution failed.
 */
public record Resolution(ContentRecord content, String failure) {

    public static Resolution resolved(ContentRecord content) {
        return new Resolution(content, null);
    }

    public static Resolution failed(String reason) {
        return new Resolution(null, reason);
    }

    public boolean isResolved() {
        return content != null;
    }
}
