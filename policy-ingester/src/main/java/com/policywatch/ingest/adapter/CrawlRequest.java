package com.policywatch.ingest.adapter;

import com.policywatch.ingest.model.CrawlDepth;
import com.policywatch.ingest.model.CrawlMode;

public record CrawlRequest(CrawlMode mode, CrawlDepth depth) {
}
