package com.policywatch.ingest.model;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

/**
 * Journal entry for each source run, written to the ingest_runs table and/or CSV.
 */
@Data
@Builder
public class IngestRun {

    private String runId;           // UUID
    private String sourceName;
    private CrawlMode mode;
    private OffsetDateTime startedAt;
    private OffsetDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | PARTIAL | FAILED
    private int seen;
    private int newCount;
    private int upserted;
    private int failed;
    private boolean stoppedAtCutoff;
    private boolean fastExit;
    private int pages;
    private String errorMessage;    // null on success
}
