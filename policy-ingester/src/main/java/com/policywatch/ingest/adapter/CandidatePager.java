package com.policywatch.ingest.adapter;

import com.policywatch.ingest.model.CandidateItem;

import java.io.IOException;
import java.util.List;

/**
 * Lazily pulls candidates one listing page (or feed) at a time, newest first.
 * Nothing is fetched until {@link #nextBatch()} is called.
 */
public interface CandidatePager {

    /**
     * @return the next batch, or an empty list once there are no more pages
     * @throws IOException when the page could not be retrieved; callers treat this as the end of
     *                     the listing and keep what they already have
     */
    List<CandidateItem> nextBatch() throws IOException;
}
