package com.policywatch.ingest.scheduler;

import com.policywatch.ingest.config.IngesterProperties;
import com.policywatch.ingest.store.CatalogSchema;
import com.policywatch.ingest.sync.IncrementalSyncService;
import com.policywatch.ingest.sync.SummaryRepairService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup ingestion.
 *
 * Default schedule: every six hours on the hour, UTC. A source that already has items runs in
 * incremental mode, so frequent runs only cost a few listing pages each.
 *
 * Override with INGEST_CRON env var or policy-ingester.scheduling.cron property.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IngestScheduler {

    private final IncrementalSyncService syncService;
    private final SummaryRepairService repairService;
    private final CatalogSchema catalogSchema;
    private final IngesterProperties properties;

    /**
     * On application startup:
     *  1. Always ensure the catalog schema exists
     *  2. Optionally ingest every source if RUN_ON_STARTUP=true
     */
    @PostConstruct
    public void onStartup() {
        try {
            catalogSchema.ensureSchema();
        } catch (Exception e) {
            log.warn("Could not initialise catalog schema: {}", e.getMessage());
        }

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, ingesting {} sources", properties.getSources().size());
            try {
                syncService.ingestAll();
            } catch (Exception e) {
                log.error("Startup ingest failed: {}", e.getMessage(), e);
            }
        } else {
            log.info("Ingester ready. Next scheduled run: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${policy-ingester.scheduling.cron:0 0 */6 * * *}", zone = "UTC")
    public void scheduledIngest() {
        log.info("Scheduled ingest triggered");
        try {
            syncService.ingestAll();
        } catch (Exception e) {
            log.error("Scheduled ingest failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Summary repair across all enabled sources. Off unless REPAIR_CRON is set.
     */
    @Scheduled(cron = "${policy-ingester.repair.cron:-}", zone = "UTC")
    public void scheduledRepair() {
        log.info("Scheduled summary repair triggered");
        try {
            repairService.repair(null, null);
        } catch (Exception e) {
            log.error("Scheduled summary repair failed: {}", e.getMessage(), e);
        }
    }
}
