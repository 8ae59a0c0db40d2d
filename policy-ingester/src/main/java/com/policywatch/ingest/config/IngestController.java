package com.policywatch.ingest.config;

import com.policywatch.ingest.journal.JdbcRunJournal;
import com.policywatch.ingest.model.IngestResult;
import com.policywatch.ingest.model.RepairResult;
import com.policywatch.ingest.polish.PolishGate;
import com.policywatch.ingest.sync.IncrementalSyncService;
import com.policywatch.ingest.sync.SummaryRepairService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class IngestController {

    private final IncrementalSyncService syncService;
    private final SummaryRepairService repairService;
    private final IngesterProperties properties;
    private final PolishGate polishGate;
    private final JdbcRunJournal runJournal;

    // ── Ingest triggers ──────────────────────────────────────────────────────

    /**
     * Runs one source synchronously and returns its counters.
     *
     * POST /ingest/ca-governor?limit=20&maxPages=2
     */
    @PostMapping("/ingest/{source}")
    public ResponseEntity<?> ingest(@PathVariable String source,
                                    @RequestParam(required = false) Integer limit,
                                    @RequestParam(required = false) Integer maxPages) {
        try {
            IngestResult result = syncService.ingest(source, limit, maxPages);
            return ResponseEntity.ok(result);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/ingest/trigger/all")
    public ResponseEntity<Map<String, String>> triggerAll() {
        new Thread(syncService::ingestAll, "manual-ingest-all").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "target", "all"));
    }

    // ── Summary maintenance ──────────────────────────────────────────────────

    /**
     * Re-fetches and re-summarizes items with missing or poor summaries.
     *
     * POST /ingest/summaries/repair?source=wa-governor&limit=20
     */
    @PostMapping("/ingest/summaries/repair")
    public ResponseEntity<?> repairSummaries(@RequestParam(required = false) String source,
                                             @RequestParam(required = false) Integer limit) {
        try {
            List<RepairResult> results = repairService.repair(source, limit);
            return ResponseEntity.ok(results);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/ingest/summaries/repolish")
    public ResponseEntity<?> repolishSummaries(@RequestParam(required = false) String source,
                                               @RequestParam(required = false) Integer limit) {
        try {
            List<RepairResult> results = repairService.repolish(source, limit);
            return ResponseEntity.ok(results);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/ingest/status")
    public ResponseEntity<Map<String, Object>> status() {
        List<Map<String, Object>> sources = properties.getSources().stream()
                .map(s -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("name", s.getName());
                    entry.put("adapter", s.getAdapter());
                    entry.put("enabled", s.isEnabled());
                    entry.put("lastRun", lastStatus(s.getName()));
                    return entry;
                })
                .toList();

        Map<String, Object> polish = new LinkedHashMap<>();
        polish.put("provider", polishGate.providerName());
        polish.put("usedToday", polishGate.budget().used());
        polish.put("dailyBudget", polishGate.budget().isUnlimited() ? "unlimited" : polishGate.budget().dailyBudget());

        return ResponseEntity.ok(Map.of(
                "service", "policy-ingester",
                "schedule", properties.getScheduling().getCron(),
                "sources", sources,
                "polish", polish
        ));
    }

    private String lastStatus(String sourceName) {
        try {
            return runJournal.lastStatus(sourceName).orElse("never");
        } catch (RuntimeException e) {
            log.debug("Run journal unavailable: {}", e.getMessage());
            return "unknown";
        }
    }
}
