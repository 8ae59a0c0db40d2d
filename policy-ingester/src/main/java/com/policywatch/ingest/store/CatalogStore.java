package com.policywatch.ingest.store;

import com.policywatch.ingest.model.CatalogItem;
import com.policywatch.ingest.model.Source;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence for sources and catalog items. Every method is a single round trip in its own
 * transaction; a failure surfaces as a {@link org.springframework.dao.DataAccessException}.
 */
public interface CatalogStore {

    /** Looks the source up by its unique name, creating it on first use */
    Source getOrCreateSource(String name, String kind, String baseUrl);

    long countItems(long sourceId);

    /**
     * The subset of {@code externalIds} already stored for the source, matching either an item's
     * externalId or an entry id recorded for it
     */
    Set<String> existingExternalIds(long sourceId, Collection<String> externalIds);

    /**
     * Inserts or updates by (sourceId, externalId). Descriptive fields are overwritten,
     * a stored publishedAt is never replaced or cleared, fetchedAt always takes the new value.
     * A non-null entryId that differs from externalId is recorded as an alias of the item.
     */
    void upsert(CatalogItem item);

    Optional<CatalogItem> findItem(long sourceId, String externalId);

    /**
     * Newest items first whose summary is missing, blank, shorter than {@code minLength}, longer
     * than {@code maxLength}, or still opens with enacting or breadcrumb boilerplate.
     */
    List<CatalogItem> findItemsNeedingSummary(long sourceId, int minLength, int maxLength, int limit);

    /** Newest items first that have a non-blank summary */
    List<CatalogItem> findSummarizedItems(long sourceId, int limit);

    /** Replaces only the summary; false when the item does not exist */
    boolean updateSummary(long sourceId, String externalId, String summary);
}
