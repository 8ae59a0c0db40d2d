package com.policywatch.ingest.sync;

import com.policywatch.ingest.config.IngesterProperties;
import com.policywatch.ingest.model.CrawlDepth;
import com.policywatch.ingest.model.CrawlMode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * (mode, requested pages, requested items) to effective scan bounds.
 *
 * Backfill honours the request; zero or negative means unbounded, though pages never exceed the
 * global safety ceiling. Incremental clamps the request to the source's own small bounds, and
 * falls back to those bounds when nothing positive was requested.
 */
@Component
@RequiredArgsConstructor
public class CrawlDepthPolicy {

    private final IngesterProperties properties;

    public CrawlDepth effective(CrawlMode mode, Integer requestedPages, Integer requestedItems,
                                IngesterProperties.SourceDefinition source) {
        int pages = requestedPages != null ? requestedPages : properties.getScheduling().getDefaultMaxPages();
        int items = requestedItems != null ? requestedItems : properties.getScheduling().getDefaultLimit();

        if (mode == CrawlMode.BACKFILL) {
            int ceiling = Math.max(1, properties.getScheduling().getBackfillMaxPagesSafety());
            return new CrawlDepth(
                    pages > 0 ? Math.min(pages, ceiling) : ceiling,
                    items > 0 ? items : Integer.MAX_VALUE);
        }

        int pageBound = Math.max(1, source.getIncrementalMaxPages());
        int itemBound = Math.max(1, source.getIncrementalMaxItems());
        return new CrawlDepth(
                pages > 0 ? Math.min(pages, pageBound) : pageBound,
                items > 0 ? Math.min(items, itemBound) : itemBound);
    }
}
