package com.policywatch.ingest;

import com.policywatch.ingest.store.CatalogStore;
import com.policywatch.ingest.sync.CandidateProcessor;
import com.policywatch.ingest.sync.IncrementalSyncService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class PolicyIngesterApplicationTest {

    @Autowired
    private CatalogStore store;

    @Autowired
    private IncrementalSyncService syncService;

    @Autowired
    private CandidateProcessor processor;

    @Test
    @DisplayName("Context starts against H2 and the catalog schema is usable")
    void contextLoads() {
        long sourceId = store.getOrCreateSource("smoke", "notice", "https://example.gov").getId();

        assertThat(store.countItems(sourceId)).isZero();
        assertThat(syncService).isNotNull();
        assertThat(processor).isNotNull();
    }
}
