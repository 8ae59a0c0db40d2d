package com.policywatch.ingest.model;

/**
 * Effective scan bounds for one run.
 *
 * @param maxPages listing batches to request
 * @param maxItems resolutions to attempt, {@link Integer#MAX_VALUE} when unbounded
 */
public record CrawlDepth(int maxPages, int maxItems) {
}
