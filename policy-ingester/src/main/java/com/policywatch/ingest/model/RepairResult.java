package com.policywatch.ingest.model;

import lombok.Builder;
import lombok.Data;

/**
 * Counters from one summary repair or re-polish pass over a source.
 */
@Data
@Builder
public class RepairResult {

    private String source;
    private int examined;
    private int updated;
    private int polished;
    private int skipped;
    private int failed;
}
