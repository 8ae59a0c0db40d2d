package com.policywatch.ingest.resolve;

import lombok.Builder;
import lombok.Value;
import org.jsoup.nodes.Document;

import java.time.OffsetDateTime;

/**
 * Everything the publication-date waterfall may look at. Any field may be null.
 */
@Value
@Builder
public class DateEvidence {

    /** Date the listing or feed attached to the entry; wins over everything else */
    OffsetDateTime explicitDate;

    /** Parsed page, null for non-markup documents */
    Document document;

    /** Extracted body text */
    String text;

    /** Canonical URL */
    String url;

    /** Creation/modification timestamp embedded in a binary document */
    OffsetDateTime documentTimestamp;

    OffsetDateTime lastModified;
}
