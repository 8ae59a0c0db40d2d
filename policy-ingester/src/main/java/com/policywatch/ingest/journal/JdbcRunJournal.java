package com.policywatch.ingest.journal;

import com.policywatch.ingest.model.IngestRun;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Types;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JdbcRunJournal {

    private final NamedParameterJdbcTemplate jdbc;

    public void write(IngestRun run) {
        jdbc.update("""
                INSERT INTO ingest_runs
                (run_id, source_name, crawl_mode, started_at, completed_at, status, seen_count, new_count,
                 upserted_count, failed_count, pages, stopped_at_cutoff, fast_exit, error_message)
                VALUES
                (:runId, :sourceName, :mode, :startedAt, :completedAt, :status, :seen, :newCount,
                 :upserted, :failed, :pages, :stoppedAtCutoff, :fastExit, :errorMessage)
                """,
                new MapSqlParameterSource()
                        .addValue("runId", run.getRunId())
                        .addValue("sourceName", run.getSourceName())
                        .addValue("mode", run.getMode() == null ? null : run.getMode().label())
                        .addValue("startedAt", run.getStartedAt(), Types.TIMESTAMP_WITH_TIMEZONE)
                        .addValue("completedAt", run.getCompletedAt(), Types.TIMESTAMP_WITH_TIMEZONE)
                        .addValue("status", run.getStatus())
                        .addValue("seen", run.getSeen())
                        .addValue("newCount", run.getNewCount())
                        .addValue("upserted", run.getUpserted())
                        .addValue("failed", run.getFailed())
                        .addValue("pages", run.getPages())
                        .addValue("stoppedAtCutoff", run.isStoppedAtCutoff())
                        .addValue("fastExit", run.isFastExit())
                        .addValue("errorMessage", truncate(run.getErrorMessage())));
    }

    /** Status of the most recent run per source, for the status endpoint */
    public Optional<String> lastStatus(String sourceName) {
        List<String> rows = jdbc.queryForList("""
                SELECT status FROM ingest_runs
                WHERE source_name = :sourceName
                ORDER BY started_at DESC
                FETCH FIRST 1 ROWS ONLY
                """,
                new MapSqlParameterSource("sourceName", sourceName),
                String.class);
        return rows.stream().findFirst();
    }

    private static String truncate(String s) {
        return s == null || s.length() <= 2000 ? s : s.substring(0, 2000);
    }
}
