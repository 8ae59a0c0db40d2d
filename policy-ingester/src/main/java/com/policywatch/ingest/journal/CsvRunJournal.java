package com.policywatch.ingest.journal;

import com.opencsv.CSVWriter;
import com.policywatch.ingest.config.IngesterProperties;
import com.policywatch.ingest.model.IngestRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.format.DateTimeFormatter;

/**
 * Appends run records to a daily CSV file.
 *
 * Output path pattern: {outputDir}/ingest_runs_{yyyy-MM-dd}.csv, keyed by the run's start date (UTC).
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvRunJournal {

    static final String[] HEADERS = {
            "run_id", "source_name", "mode",
            "started_at", "completed_at", "status",
            "seen", "new", "upserted", "failed", "pages",
            "stopped_at_cutoff", "fast_exit", "error_message"
    };

    private final IngesterProperties properties;

    public synchronized Path write(IngestRun run) {
        Path outputDir = Paths.get(properties.getJournal().getCsv().getOutputDir());
        ensureDirectory(outputDir);

        String day = run.getStartedAt() == null ? "unknown" : run.getStartedAt().format(DateTimeFormatter.ISO_LOCAL_DATE);
        Path outputPath = outputDir.resolve("ingest_runs_" + day + ".csv");
        boolean newFile = !Files.exists(outputPath);

        try (CSVWriter writer = new CSVWriter(
                new FileWriter(outputPath.toFile(), StandardCharsets.UTF_8, true),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (newFile && properties.getJournal().getCsv().isIncludeHeader()) {
                writer.writeNext(HEADERS);
            }
            writer.writeNext(toRow(run));
            log.debug("Appended run {} to {}", run.getRunId(), outputPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Run journal CSV write failed: " + outputPath, e);
        }
        return outputPath;
    }

    private String[] toRow(IngestRun r) {
        return new String[]{
                str(r.getRunId()),
                str(r.getSourceName()),
                r.getMode() == null ? "" : r.getMode().label(),
                str(r.getStartedAt()),
                str(r.getCompletedAt()),
                str(r.getStatus()),
                str(r.getSeen()),
                str(r.getNewCount()),
                str(r.getUpserted()),
                str(r.getFailed()),
                str(r.getPages()),
                str(r.isStoppedAtCutoff()),
                str(r.isFastExit()),
                str(r.getErrorMessage())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory: " + dir, e);
        }
    }
}
