package com.policywatch.ingest.model;

import java.time.OffsetDateTime;

/**
 * One entry discovered on a listing page or feed, before any detail fetch.
 *
 * @param sourceId   owning source
 * @param externalId canonical detail URL
 * @param titleHint  anchor or feed title, may be null
 * @param dateHint   listing/feed date, may be null
 */
public record CandidateItem(long sourceId, String externalId, String titleHint, OffsetDateTime dateHint) {

    public CandidateItem withExternalId(String canonical) {
        return new CandidateItem(sourceId, canonical, titleHint, dateHint);
    }
}
