package com.policywatch.ingest.sync;

import com.policywatch.ingest.adapter.CandidatePager;
import com.policywatch.ingest.adapter.CrawlRequest;
import com.policywatch.ingest.adapter.SourceAdapter;
import com.policywatch.ingest.adapter.SourceAdapterRegistry;
import com.policywatch.ingest.config.IngesterProperties;
import com.policywatch.ingest.journal.RunJournalRouter;
import com.policywatch.ingest.model.CandidateItem;
import com.policywatch.ingest.model.CrawlDepth;
import com.policywatch.ingest.model.CrawlMode;
import com.policywatch.ingest.model.IngestResult;
import com.policywatch.ingest.model.IngestRun;
import com.policywatch.ingest.model.Source;
import com.policywatch.ingest.resolve.UrlCanonicalizer;
import com.policywatch.ingest.store.CatalogStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Drives one source run: pick the crawl mode, page through candidates newest first, drop what is
 * already stored, and hand the rest to the {@link CandidateProcessor}.
 *
 * Stopping rules, checked after each batch:
 *  - the cutoff id was in the batch (both modes; the batch is cut to end at it, inclusive)
 *  - the item limit was reached
 *  - incremental mode only: the first batch contained an id that is already stored
 *  - the pager ran dry or failed
 *
 * {@link #ingest} never throws for a configured source: per-item and listing failures end up in
 * the counters and the run journal.
 */
@Service
@Slf4j
public class IncrementalSyncService {

    private static final Comparator<CandidateItem> NEWEST_FIRST = Comparator.comparing(
            CandidateItem::dateHint, Comparator.nullsLast(Comparator.reverseOrder()));

    private final IngesterProperties properties;
    private final CatalogStore store;
    private final SourceAdapterRegistry adapters;
    private final CrawlDepthPolicy depthPolicy;
    private final CandidateProcessor processor;
    private final RunJournalRouter journal;
    private final Executor ingestExecutor;
    private final Clock clock;

    public IncrementalSyncService(IngesterProperties properties,
                                  CatalogStore store,
                                  SourceAdapterRegistry adapters,
                                  CrawlDepthPolicy depthPolicy,
                                  CandidateProcessor processor,
                                  RunJournalRouter journal,
                                  @Qualifier("ingestExecutor") Executor ingestExecutor,
                                  Clock clock) {
        this.properties = properties;
        this.store = store;
        this.adapters = adapters;
        this.depthPolicy = depthPolicy;
        this.processor = processor;
        this.journal = journal;
        this.ingestExecutor = ingestExecutor;
        this.clock = clock;
    }

    /**
     * @param sourceName configured source name (case-insensitive)
     * @param limit      max items to resolve; null uses the configured default, 0 or less is unbounded in backfill
     * @param maxPages   max listing pages; null uses the configured default, 0 or less is unbounded in backfill
     * @throws IllegalArgumentException when no source with that name is configured
     */
    public IngestResult ingest(String sourceName, Integer limit, Integer maxPages) {
        IngesterProperties.SourceDefinition definition = properties.findSource(sourceName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown source: " + sourceName));

        IngestRun run = IngestRun.builder()
                .runId(UUID.randomUUID().toString())
                .sourceName(definition.getName())
                .startedAt(OffsetDateTime.now(clock))
                .status("RUNNING")
                .build();
        RunState state = new RunState();

        try {
            Source source = store.getOrCreateSource(definition.getName(), definition.getKind(), definition.getBaseUrl());
            CrawlMode mode = CrawlMode.forItemCount(store.countItems(source.getId()));
            CrawlDepth depth = depthPolicy.effective(mode, maxPages, limit, definition);
            run.setMode(mode);
            state.mode = mode;

            log.info("[{}] Starting {} run (pages<={}, items<={})", definition.getName(), mode.label(),
                    depth.maxPages(), depth.maxItems() == Integer.MAX_VALUE ? "unbounded" : depth.maxItems());

            scan(source, definition, mode, depth, state);
            run.setStatus(state.failed > 0 || state.listingError != null ? "PARTIAL" : "SUCCESS");
            run.setErrorMessage(state.listingError);
        } catch (RuntimeException e) {
            log.error("[{}] Run failed: {}", definition.getName(), e.getMessage(), e);
            run.setStatus("FAILED");
            run.setErrorMessage(e.getMessage());
        } finally {
            run.setCompletedAt(OffsetDateTime.now(clock));
            run.setSeen(state.seen);
            run.setNewCount(state.newCount);
            run.setUpserted(state.upserted);
            run.setFailed(state.failed);
            run.setPages(state.pages);
            run.setStoppedAtCutoff(state.stoppedAtCutoff);
            run.setFastExit(state.fastExit);
            journal.record(run);
        }

        log.info("[{}] {} run {}: seen={} new={} upserted={} failed={} pages={} cutoff={} fastExit={}",
                definition.getName(), state.mode == null ? "?" : state.mode.label(), run.getStatus(),
                state.seen, state.newCount, state.upserted, state.failed, state.pages,
                state.stoppedAtCutoff, state.fastExit);

        return IngestResult.builder()
                .source(definition.getName())
                .seen(state.seen)
                .newCount(state.newCount)
                .upserted(state.upserted)
                .failed(state.failed)
                .stoppedAtCutoff(state.stoppedAtCutoff)
                .fastExit(state.fastExit)
                .pages(state.pages)
                .mode(state.mode)
                .build();
    }

    /**
     * Runs every enabled source concurrently on the ingest executor and waits for all of them.
     */
    public List<IngestResult> ingestAll() {
        List<CompletableFuture<IngestResult>> runs = properties.getSources().stream()
                .filter(IngesterProperties.SourceDefinition::isEnabled)
                .map(def -> CompletableFuture.supplyAsync(() -> ingest(def.getName(), null, null), ingestExecutor)
                        .exceptionally(e -> {
                            log.error("[{}] Run aborted: {}", def.getName(), e.getMessage(), e);
                            return IngestResult.builder().source(def.getName()).build();
                        }))
                .collect(Collectors.toList());

        return runs.stream().map(CompletableFuture::join).collect(Collectors.toList());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void scan(Source source, IngesterProperties.SourceDefinition definition, CrawlMode mode,
                      CrawlDepth depth, RunState state) {
        SourceAdapter adapter = adapters.forType(definition.getAdapter());
        CandidatePager pager = adapter.open(source, definition, new CrawlRequest(mode, depth));
        String cutoff = UrlCanonicalizer.canonicalize(definition.getCutoffExternalId());
        int attempted = 0;

        while (state.pages < depth.maxPages()) {
            List<CandidateItem> batch;
            try {
                batch = pager.nextBatch();
            } catch (IOException e) {
                log.warn("[{}] Listing failed after {} page(s), keeping progress: {}",
                        source.getName(), state.pages, e.getMessage());
                state.listingError = e.getMessage();
                return;
            }
            if (batch.isEmpty()) {
                return;
            }
            state.pages++;

            batch = new ArrayList<>(batch);
            if (!adapter.guaranteesOrder()) {
                batch.sort(NEWEST_FIRST);
            }
            int cutoffAt = indexOf(batch, cutoff);
            if (cutoffAt >= 0) {
                batch = batch.subList(0, cutoffAt + 1);
                state.stoppedAtCutoff = true;
            }
            state.seen += batch.size();

            Set<String> known = store.existingExternalIds(source.getId(),
                    batch.stream().map(CandidateItem::externalId).collect(Collectors.toList()));
            List<CandidateItem> unseen = batch.stream()
                    .filter(c -> !known.contains(c.externalId()))
                    .collect(Collectors.toList());
            state.newCount += unseen.size();

            List<CandidateItem> work = mode == CrawlMode.INCREMENTAL ? unseen : batch;
            boolean limitReached = false;
            for (CandidateItem candidate : work) {
                if (attempted >= depth.maxItems()) {
                    limitReached = true;
                    break;
                }
                attempted++;
                ItemOutcome outcome = processor.process(candidate, source, definition);
                if (outcome == ItemOutcome.UPSERTED) {
                    state.upserted++;
                } else {
                    state.failed++;
                }
            }
            log.debug("[{}] Page {}: {} candidates, {} new, {} attempted so far",
                    source.getName(), state.pages, batch.size(), unseen.size(), attempted);

            if (state.stoppedAtCutoff) {
                log.info("[{}] Reached cutoff {}", source.getName(), cutoff);
                return;
            }
            if (limitReached || attempted >= depth.maxItems()) {
                return;
            }
            if (mode == CrawlMode.INCREMENTAL && state.pages == 1 && !known.isEmpty()) {
                state.fastExit = true;
                return;
            }
        }
    }

    private static int indexOf(List<CandidateItem> batch, String externalId) {
        if (externalId == null) {
            return -1;
        }
        for (int i = 0; i < batch.size(); i++) {
            if (externalId.equals(batch.get(i).externalId())) {
                return i;
            }
        }
        return -1;
    }

    private static final class RunState {
        CrawlMode mode;
        int seen;
        int newCount;
        int upserted;
        int failed;
        int pages;
        boolean stoppedAtCutoff;
        boolean fastExit;
        String listingError;
    }
}
