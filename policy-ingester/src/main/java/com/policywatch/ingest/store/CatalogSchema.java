package com.policywatch.ingest.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the catalog tables when they are missing. The DDL is plain SQL understood by both
 * PostgreSQL and H2.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CatalogSchema {

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring catalog schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS sources
            (
                id          BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                name        VARCHAR(200) NOT NULL UNIQUE,
                kind        VARCHAR(100),
                base_url    VARCHAR(2048),
                created_at  TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS items
            (
                id            BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                source_id     BIGINT NOT NULL REFERENCES sources (id),
                external_id   VARCHAR(2048) NOT NULL,
                title         VARCHAR,
                summary       VARCHAR,
                url           VARCHAR(2048),
                jurisdiction  VARCHAR(200),
                agency        VARCHAR(300),
                status        VARCHAR(100),
                published_at  TIMESTAMP WITH TIME ZONE,
                fetched_at    TIMESTAMP WITH TIME ZONE NOT NULL,
                UNIQUE (source_id, external_id)
            )
        """);

        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_items_published_at ON items (published_at)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS item_aliases
            (
                source_id    BIGINT NOT NULL REFERENCES sources (id),
                entry_id     VARCHAR(2048) NOT NULL,
                external_id  VARCHAR(2048) NOT NULL,
                PRIMARY KEY (source_id, entry_id)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS ingest_runs
            (
                run_id             VARCHAR(64) PRIMARY KEY,
                source_name        VARCHAR(200) NOT NULL,
                crawl_mode         VARCHAR(20),
                started_at         TIMESTAMP WITH TIME ZONE NOT NULL,
                completed_at       TIMESTAMP WITH TIME ZONE,
                status             VARCHAR(20) NOT NULL,
                seen_count         INT,
                new_count          INT,
                upserted_count     INT,
                failed_count       INT,
                pages              INT,
                stopped_at_cutoff  BOOLEAN,
                fast_exit          BOOLEAN,
                error_message      VARCHAR(2000)
            )
        """);

        log.info("Catalog schema ready.");
    }
}
