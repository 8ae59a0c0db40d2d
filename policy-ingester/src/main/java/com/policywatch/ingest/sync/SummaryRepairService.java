package com.policywatch.ingest.sync;

import com.policywatch.ingest.config.IngesterProperties;
import com.policywatch.ingest.model.CandidateItem;
import com.policywatch.ingest.model.CatalogItem;
import com.policywatch.ingest.model.RepairResult;
import com.policywatch.ingest.model.Source;
import com.policywatch.ingest.polish.PolishGate;
import com.policywatch.ingest.polish.PolishOutcome;
import com.policywatch.ingest.polish.PolishResult;
import com.policywatch.ingest.resolve.ContentResolver;
import com.policywatch.ingest.resolve.Resolution;
import com.policywatch.ingest.store.CatalogStore;
import com.policywatch.ingest.summarize.ExtractiveSummarizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

/**
 * Maintenance passes over already stored items.
 *
 * <ul>
 *   <li>{@link #repair}: items with a missing, too short, too long or boilerplate summary are
 *       fetched again, summarized again and polished.</li>
 *   <li>{@link #repolish}: existing summaries are sent through the polish gate without
 *       fetching anything.</li>
 * </ul>
 *
 * Both share the polish gate, and so the daily budget, with regular ingestion. Only the summary
 * column is written.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SummaryRepairService {

    private final IngesterProperties properties;
    private final CatalogStore store;
    private final ContentResolver resolver;
    private final ExtractiveSummarizer summarizer;
    private final PolishGate polishGate;

    /**
     * @param sourceName one configured source, or null/blank for every enabled source
     * @param limit      items per source; null or non-positive uses {@code repair.batch-limit}
     * @throws IllegalArgumentException if {@code sourceName} is not configured
     */
    public List<RepairResult> repair(String sourceName, Integer limit) {
        return forSources(sourceName, limit, this::repairSource);
    }

    /**
     * Same targeting as {@link #repair}. Stops a source early once the polish gate has no
     * provider or no budget left.
     */
    public List<RepairResult> repolish(String sourceName, Integer limit) {
        return forSources(sourceName, limit, this::repolishSource);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<RepairResult> forSources(String sourceName, Integer limit,
                                          BiFunction<IngesterProperties.SourceDefinition, Integer, RepairResult> pass) {
        List<IngesterProperties.SourceDefinition> targets;
        if (sourceName == null || sourceName.isBlank()) {
            targets = properties.getSources().stream()
                    .filter(IngesterProperties.SourceDefinition::isEnabled)
                    .collect(Collectors.toList());
        } else {
            targets = List.of(properties.findSource(sourceName)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown source: " + sourceName)));
        }
        int batch = limit == null || limit <= 0 ? properties.getRepair().getBatchLimit() : limit;

        List<RepairResult> results = new ArrayList<>();
        for (IngesterProperties.SourceDefinition definition : targets) {
            results.add(pass.apply(definition, batch));
        }
        return results;
    }

    private RepairResult repairSource(IngesterProperties.SourceDefinition definition, int batch) {
        IngesterProperties.Repair repair = properties.getRepair();
        Source source = store.getOrCreateSource(definition.getName(), definition.getKind(), definition.getBaseUrl());
        List<CatalogItem> items = store.findItemsNeedingSummary(
                source.getId(), repair.getMinLength(), repair.getMaxLength(), batch);
        RepairResult result = RepairResult.builder().source(definition.getName()).build();

        for (CatalogItem item : items) {
            result.setExamined(result.getExamined() + 1);
            String url = item.getUrl() != null ? item.getUrl() : item.getExternalId();
            try {
                Resolution resolution = resolver.resolve(
                        new CandidateItem(source.getId(), url, item.getTitle(), null), definition);
                if (!resolution.isResolved()) {
                    log.warn("[{}] Repair could not fetch {}: {}", definition.getName(), url, resolution.failure());
                    result.setFailed(result.getFailed() + 1);
                    continue;
                }
                String text = resolution.content().getBodyText();
                String summary = summarizer.summarize(text);
                if (summary.isEmpty()) {
                    summary = summarizer.firstParagraph(text);
                }
                if (summary.isEmpty()) {
                    log.debug("[{}] Nothing to summarize at {}", definition.getName(), url);
                    result.setSkipped(result.getSkipped() + 1);
                    continue;
                }
                PolishResult polished = polishGate.polish(summary, item.getTitle(), url);
                if (polished.isPolished()) {
                    result.setPolished(result.getPolished() + 1);
                }
                if (store.updateSummary(source.getId(), item.getExternalId(), polished.text())) {
                    result.setUpdated(result.getUpdated() + 1);
                }
            } catch (RuntimeException e) {
                log.warn("[{}] Repair failed for {}: {}", definition.getName(), url, e.getMessage());
                result.setFailed(result.getFailed() + 1);
            }
        }

        log.info("[{}] Summary repair: examined={} updated={} polished={} skipped={} failed={}",
                definition.getName(), result.getExamined(), result.getUpdated(), result.getPolished(),
                result.getSkipped(), result.getFailed());
        return result;
    }

    private RepairResult repolishSource(IngesterProperties.SourceDefinition definition, int batch) {
        Source source = store.getOrCreateSource(definition.getName(), definition.getKind(), definition.getBaseUrl());
        RepairResult result = RepairResult.builder().source(definition.getName()).build();

        for (CatalogItem item : store.findSummarizedItems(source.getId(), batch)) {
            result.setExamined(result.getExamined() + 1);
            PolishResult polished = polishGate.polish(item.getSummary(), item.getTitle(), item.getUrl());
            if (polished.outcome() == PolishOutcome.SKIPPED_NO_PROVIDER
                    || polished.outcome() == PolishOutcome.SKIPPED_BUDGET) {
                log.info("[{}] Re-polish stopped: {}", definition.getName(), polished.outcome());
                result.setSkipped(result.getSkipped() + 1);
                break;
            }
            if (!polished.isPolished() || polished.text().equals(item.getSummary())) {
                result.setSkipped(result.getSkipped() + 1);
                continue;
            }
            result.setPolished(result.getPolished() + 1);
            try {
                if (store.updateSummary(source.getId(), item.getExternalId(), polished.text())) {
                    result.setUpdated(result.getUpdated() + 1);
                }
            } catch (RuntimeException e) {
                log.warn("[{}] Could not store re-polished summary for {}: {}",
                        definition.getName(), item.getExternalId(), e.getMessage());
                result.setFailed(result.getFailed() + 1);
            }
        }

        log.info("[{}] Re-polish: examined={} updated={} skipped={} failed={}", definition.getName(),
                result.getExamined(), result.getUpdated(), result.getSkipped(), result.getFailed());
        return result;
    }
}
