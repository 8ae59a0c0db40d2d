package com.policywatch.ingest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

/**
 * Per-source counters returned by one ingest run. This shape is the outward contract.
 */
@Data
@Builder
public class IngestResult {

    private String source;
    private int seen;

    @JsonProperty("new")
    private int newCount;

    private int upserted;
    private int failed;

    @JsonProperty("stopped_at_cutoff")
    private boolean stoppedAtCutoff;

    @JsonProperty("fast_exit")
    private boolean fastExit;

    private int pages;
    private CrawlMode mode;
}
