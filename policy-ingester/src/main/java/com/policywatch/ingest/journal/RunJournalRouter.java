package com.policywatch.ingest.journal;

import com.policywatch.ingest.config.IngesterProperties;
import com.policywatch.ingest.model.IngestRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Routes run records to the database, a CSV file, or both. A journal failure is logged and never
 * affects the run it describes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RunJournalRouter {

    private final JdbcRunJournal jdbcRunJournal;
    private final CsvRunJournal csvRunJournal;
    private final IngesterProperties properties;

    public void record(IngestRun run) {
        IngesterProperties.Journal.JournalMode mode = properties.getJournal().getMode();
        switch (mode) {
            case DATABASE -> attempt("database", run, () -> jdbcRunJournal.write(run));
            case CSV -> attempt("csv", run, () -> csvRunJournal.write(run));
            case BOTH -> {
                attempt("database", run, () -> jdbcRunJournal.write(run));
                attempt("csv", run, () -> csvRunJournal.write(run));
            }
        }
    }

    private void attempt(String sink, IngestRun run, Runnable write) {
        try {
            write.run();
        } catch (RuntimeException e) {
            log.warn("Failed to journal run {} for {} to {}: {}",
                    run.getRunId(), run.getSourceName(), sink, e.getMessage());
        }
    }
}
