package com.policywatch.ingest.sync;

import com.policywatch.ingest.config.IngesterProperties;
import com.policywatch.ingest.model.CrawlDepth;
import com.policywatch.ingest.model.CrawlMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CrawlDepthPolicyTest {

    private IngesterProperties properties;
    private IngesterProperties.SourceDefinition source;
    private CrawlDepthPolicy policy;

    @BeforeEach
    void setUp() {
        properties = new IngesterProperties();
        source = new IngesterProperties.SourceDefinition();
        source.setIncrementalMaxPages(3);
        source.setIncrementalMaxItems(25);
        policy = new CrawlDepthPolicy(properties);
    }

    @Test
    @DisplayName("Backfill honours the request and treats zero as unbounded under the safety ceiling")
    void backfill() {
        assertThat(policy.effective(CrawlMode.BACKFILL, 10, 50, source)).isEqualTo(new CrawlDepth(10, 50));
        assertThat(policy.effective(CrawlMode.BACKFILL, 0, 0, source)).isEqualTo(new CrawlDepth(500, Integer.MAX_VALUE));
        assertThat(policy.effective(CrawlMode.BACKFILL, 10_000, null, source).maxPages()).isEqualTo(500);
    }

    @Test
    @DisplayName("Incremental clamps the request to the source bounds")
    void incremental() {
        assertThat(policy.effective(CrawlMode.INCREMENTAL, 100, 1000, source)).isEqualTo(new CrawlDepth(3, 25));
        assertThat(policy.effective(CrawlMode.INCREMENTAL, 2, 10, source)).isEqualTo(new CrawlDepth(2, 10));
        assertThat(policy.effective(CrawlMode.INCREMENTAL, null, null, source)).isEqualTo(new CrawlDepth(3, 25));
        assertThat(policy.effective(CrawlMode.INCREMENTAL, -1, 0, source)).isEqualTo(new CrawlDepth(3, 25));
    }

    @Test
    @DisplayName("Scheduled defaults apply when nothing was requested")
    void defaults() {
        properties.getScheduling().setDefaultMaxPages(20);
        properties.getScheduling().setDefaultLimit(100);

        assertThat(policy.effective(CrawlMode.BACKFILL, null, null, source)).isEqualTo(new CrawlDepth(20, 100));
    }
}
