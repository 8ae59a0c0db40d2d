package com.policywatch.ingest.journal;

import com.opencsv.CSVReader;
import com.policywatch.ingest.config.IngesterProperties;
import com.policywatch.ingest.model.CrawlMode;
import com.policywatch.ingest.model.IngestRun;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CsvRunJournalTest {

    @TempDir
    Path outputDir;

    private CsvRunJournal journal(boolean includeHeader) {
        IngesterProperties properties = new IngesterProperties();
        properties.getJournal().getCsv().setOutputDir(outputDir.toString());
        properties.getJournal().getCsv().setIncludeHeader(includeHeader);
        return new CsvRunJournal(properties);
    }

    private static IngestRun run(String id) {
        return IngestRun.builder()
                .runId(id)
                .sourceName("wh_executive_orders")
                .mode(CrawlMode.BACKFILL)
                .startedAt(OffsetDateTime.of(2025, 6, 1, 6, 0, 0, 0, ZoneOffset.UTC))
                .status("SUCCESS")
                .seen(12)
                .newCount(12)
                .upserted(11)
                .failed(1)
                .pages(2)
                .stoppedAtCutoff(true)
                .build();
    }

    private static List<String[]> read(Path file) throws Exception {
        try (CSVReader reader = new CSVReader(new FileReader(file.toFile(), StandardCharsets.UTF_8))) {
            return reader.readAll();
        }
    }

    @Test
    @DisplayName("Runs of one day append to one file under a single header")
    void appendsToDailyFile() throws Exception {
        // given
        CsvRunJournal journal = journal(true);

        // when
        Path first = journal.write(run("r1"));
        Path second = journal.write(run("r2"));

        // then
        assertThat(first).isEqualTo(second).hasFileName("ingest_runs_2025-06-01.csv");
        List<String[]> rows = read(first);
        assertThat(rows).hasSize(3);
        assertThat(rows.get(0)).containsExactly(CsvRunJournal.HEADERS);
        assertThat(rows.get(1)[0]).isEqualTo("r1");
        assertThat(rows.get(1)[2]).isEqualTo("backfill");
        assertThat(rows.get(1)[11]).isEqualTo("true");
        assertThat(rows.get(2)[0]).isEqualTo("r2");
    }

    @Test
    @DisplayName("Header can be switched off")
    void withoutHeader() throws Exception {
        Path file = journal(false).write(run("r1"));

        assertThat(read(file)).hasSize(1);
    }
}
