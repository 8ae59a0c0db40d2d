package com.policywatch.ingest.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * Resolved detail document. Lives only for the duration of one resolution.
 */
@Value
@Builder
public class ContentRecord {

    /** Canonical URL after redirects and tracking-parameter removal */
    String externalId;

    /** Best title from the title waterfall, blank when every step missed */
    String title;

    /** Plain text with paragraph breaks preserved */
    String bodyText;

    String contentType;
    OffsetDateTime fetchedAt;
    int httpStatus;

    /** Result of the publication-date waterfall, null when nothing parsed */
    OffsetDateTime publishedAt;
}
