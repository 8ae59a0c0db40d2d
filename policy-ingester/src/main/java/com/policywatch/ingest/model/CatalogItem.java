package com.policywatch.ingest.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * Persisted catalog row. Identity is (sourceId, externalId).
 *
 * Write semantics:
 *  - title, summary, url, jurisdiction, agency and status are overwritten on every upsert
 *  - publishedAt is only ever filled in, never cleared or replaced
 *  - fetchedAt advances on every successful write
 */
@Value
@Builder(toBuilder = true)
public class CatalogItem {

    String externalId;

    /** Id the item was listed under; recorded as an alias when it differs from externalId */
    String entryId;

    long sourceId;
    String title;
    String summary;
    String url;
    String jurisdiction;
    String agency;
    String status;
    OffsetDateTime publishedAt;
    OffsetDateTime fetchedAt;
}
