package com.policywatch.ingest.store;

import com.policywatch.ingest.model.CatalogItem;
import com.policywatch.ingest.model.Source;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC catalog store. PostgreSQL upserts with INSERT ... ON CONFLICT; H2 (tests, local runs)
 * with a standard MERGE. Both keep an existing published_at.
 *
 * An item listed under one URL but stored under its post-redirect URL gets a row in
 * item_aliases, written in the same transaction, so the listing URL counts as known next time.
 */
@Repository
@Slf4j
public class JdbcCatalogStore implements CatalogStore {

    private static final int IN_CLAUSE_CHUNK = 500;

    private static final String POSTGRES_UPSERT = """
            INSERT INTO items (source_id, external_id, title, summary, url, jurisdiction, agency, status,
                               published_at, fetched_at)
            VALUES (:sourceId, :externalId, :title, :summary, :url, :jurisdiction, :agency, :status,
                    :publishedAt, :fetchedAt)
            ON CONFLICT (source_id, external_id)
            DO UPDATE SET
                title = EXCLUDED.title,
                summary = EXCLUDED.summary,
                url = EXCLUDED.url,
                jurisdiction = EXCLUDED.jurisdiction,
                agency = EXCLUDED.agency,
                status = EXCLUDED.status,
                published_at = COALESCE(items.published_at, EXCLUDED.published_at),
                fetched_at = EXCLUDED.fetched_at
            """;

    private static final String STANDARD_MERGE = """
            MERGE INTO items t
            USING (SELECT CAST(:sourceId AS BIGINT) AS source_id,
                          CAST(:externalId AS VARCHAR(2048)) AS external_id,
                          CAST(:title AS VARCHAR) AS title,
                          CAST(:summary AS VARCHAR) AS summary,
                          CAST(:url AS VARCHAR(2048)) AS url,
                          CAST(:jurisdiction AS VARCHAR(200)) AS jurisdiction,
                          CAST(:agency AS VARCHAR(300)) AS agency,
                          CAST(:status AS VARCHAR(100)) AS status,
                          CAST(:publishedAt AS TIMESTAMP WITH TIME ZONE) AS published_at,
                          CAST(:fetchedAt AS TIMESTAMP WITH TIME ZONE) AS fetched_at) s
            ON (t.source_id = s.source_id AND t.external_id = s.external_id)
            WHEN MATCHED THEN UPDATE SET
                title = s.title,
                summary = s.summary,
                url = s.url,
                jurisdiction = s.jurisdiction,
                agency = s.agency,
                status = s.status,
                published_at = COALESCE(t.published_at, s.published_at),
                fetched_at = s.fetched_at
            WHEN NOT MATCHED THEN INSERT
                (source_id, external_id, title, summary, url, jurisdiction, agency, status, published_at, fetched_at)
                VALUES (s.source_id, s.external_id, s.title, s.summary, s.url, s.jurisdiction, s.agency, s.status,
                        s.published_at, s.fetched_at)
            """;

    private static final String POSTGRES_ALIAS_UPSERT = """
            INSERT INTO item_aliases (source_id, entry_id, external_id)
            VALUES (:sourceId, :entryId, :externalId)
            ON CONFLICT (source_id, entry_id)
            DO UPDATE SET external_id = EXCLUDED.external_id
            """;

    private static final String STANDARD_ALIAS_MERGE = """
            MERGE INTO item_aliases t
            USING (SELECT CAST(:sourceId AS BIGINT) AS source_id,
                          CAST(:entryId AS VARCHAR(2048)) AS entry_id,
                          CAST(:externalId AS VARCHAR(2048)) AS external_id) s
            ON (t.source_id = s.source_id AND t.entry_id = s.entry_id)
            WHEN MATCHED THEN UPDATE SET external_id = s.external_id
            WHEN NOT MATCHED THEN INSERT (source_id, entry_id, external_id)
                VALUES (s.source_id, s.entry_id, s.external_id)
            """;

    private static final String KNOWN_IDS = """
            SELECT external_id FROM items WHERE source_id = :sourceId AND external_id IN (:ids)
            UNION
            SELECT entry_id FROM item_aliases WHERE source_id = :sourceId AND entry_id IN (:ids)
            """;

    private static final String NEEDS_SUMMARY = """
            SELECT * FROM items
            WHERE source_id = :sourceId
              AND (summary IS NULL
                   OR TRIM(summary) = ''
                   OR LENGTH(summary) < :minLength
                   OR LENGTH(summary) > :maxLength
                   OR LOWER(LTRIM(summary)) LIKE 'by the authority vested%'
                   OR LOWER(LTRIM(summary)) LIKE 'briefings & statements%'
                   OR LOWER(LTRIM(summary)) LIKE 'fact sheets%')
            ORDER BY id DESC
            LIMIT :limit
            """;

    private static final RowMapper<Source> SOURCE_ROW = (rs, i) -> Source.builder()
            .id(rs.getLong("id"))
            .name(rs.getString("name"))
            .kind(rs.getString("kind"))
            .baseUrl(rs.getString("base_url"))
            .build();

    private static final RowMapper<CatalogItem> ITEM_ROW = (rs, i) -> CatalogItem.builder()
            .sourceId(rs.getLong("source_id"))
            .externalId(rs.getString("external_id"))
            .title(rs.getString("title"))
            .summary(rs.getString("summary"))
            .url(rs.getString("url"))
            .jurisdiction(rs.getString("jurisdiction"))
            .agency(rs.getString("agency"))
            .status(rs.getString("status"))
            .publishedAt(rs.getObject("published_at", OffsetDateTime.class))
            .fetchedAt(rs.getObject("fetched_at", OffsetDateTime.class))
            .build();

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate tx;
    private final boolean postgres;

    public JdbcCatalogStore(NamedParameterJdbcTemplate jdbc, TransactionTemplate tx) {
        this.jdbc = jdbc;
        this.tx = tx;
        this.postgres = detectPostgres(jdbc);
    }

    @Override
    public Source getOrCreateSource(String name, String kind, String baseUrl) {
        Optional<Source> existing = findSource(name);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            tx.executeWithoutResult(status -> jdbc.update(
                    "INSERT INTO sources (name, kind, base_url) VALUES (:name, :kind, :baseUrl)",
                    new MapSqlParameterSource()
                            .addValue("name", name)
                            .addValue("kind", kind)
                            .addValue("baseUrl", baseUrl)));
            log.info("Registered new source '{}'", name);
        } catch (DuplicateKeyException e) {
            log.debug("Source '{}' was created concurrently", name);
        }
        return findSource(name)
                .orElseThrow(() -> new IllegalStateException("Source '" + name + "' missing after insert"));
    }

    @Override
    public long countItems(long sourceId) {
        Long count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM items WHERE source_id = :sourceId",
                new MapSqlParameterSource("sourceId", sourceId),
                Long.class);
        return count == null ? 0 : count;
    }

    @Override
    public Set<String> existingExternalIds(long sourceId, Collection<String> externalIds) {
        Set<String> found = new HashSet<>();
        if (externalIds == null || externalIds.isEmpty()) {
            return found;
        }
        List<String> ids = new ArrayList<>(new HashSet<>(externalIds));
        for (int i = 0; i < ids.size(); i += IN_CLAUSE_CHUNK) {
            List<String> chunk = ids.subList(i, Math.min(i + IN_CLAUSE_CHUNK, ids.size()));
            found.addAll(jdbc.queryForList(
                    KNOWN_IDS,
                    new MapSqlParameterSource()
                            .addValue("sourceId", sourceId)
                            .addValue("ids", chunk),
                    String.class));
        }
        return found;
    }

    @Override
    public void upsert(CatalogItem item) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("sourceId", item.getSourceId())
                .addValue("externalId", item.getExternalId())
                .addValue("title", item.getTitle())
                .addValue("summary", item.getSummary())
                .addValue("url", item.getUrl())
                .addValue("jurisdiction", item.getJurisdiction())
                .addValue("agency", item.getAgency())
                .addValue("status", item.getStatus())
                .addValue("publishedAt", item.getPublishedAt(), Types.TIMESTAMP_WITH_TIMEZONE)
                .addValue("fetchedAt", item.getFetchedAt(), Types.TIMESTAMP_WITH_TIMEZONE);

        String entryId = item.getEntryId();
        boolean aliased = entryId != null && !entryId.equals(item.getExternalId());
        params.addValue("entryId", entryId);

        tx.executeWithoutResult(status -> {
            jdbc.update(postgres ? POSTGRES_UPSERT : STANDARD_MERGE, params);
            if (aliased) {
                jdbc.update(postgres ? POSTGRES_ALIAS_UPSERT : STANDARD_ALIAS_MERGE, params);
            }
        });
    }

    @Override
    public Optional<CatalogItem> findItem(long sourceId, String externalId) {
        List<CatalogItem> rows = jdbc.query(
                "SELECT * FROM items WHERE source_id = :sourceId AND external_id = :externalId",
                new MapSqlParameterSource()
                        .addValue("sourceId", sourceId)
                        .addValue("externalId", externalId),
                ITEM_ROW);
        return rows.stream().findFirst();
    }

    @Override
    public List<CatalogItem> findItemsNeedingSummary(long sourceId, int minLength, int maxLength, int limit) {
        return jdbc.query(NEEDS_SUMMARY,
                new MapSqlParameterSource()
                        .addValue("sourceId", sourceId)
                        .addValue("minLength", minLength)
                        .addValue("maxLength", maxLength)
                        .addValue("limit", limit),
                ITEM_ROW);
    }

    @Override
    public List<CatalogItem> findSummarizedItems(long sourceId, int limit) {
        return jdbc.query("""
                        SELECT * FROM items
                        WHERE source_id = :sourceId AND summary IS NOT NULL AND TRIM(summary) <> ''
                        ORDER BY id DESC
                        LIMIT :limit
                        """,
                new MapSqlParameterSource()
                        .addValue("sourceId", sourceId)
                        .addValue("limit", limit),
                ITEM_ROW);
    }

    @Override
    public boolean updateSummary(long sourceId, String externalId, String summary) {
        Integer rows = tx.execute(status -> jdbc.update(
                "UPDATE items SET summary = :summary WHERE source_id = :sourceId AND external_id = :externalId",
                new MapSqlParameterSource()
                        .addValue("summary", summary)
                        .addValue("sourceId", sourceId)
                        .addValue("externalId", externalId)));
        return rows != null && rows > 0;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Optional<Source> findSource(String name) {
        return jdbc.query("SELECT id, name, kind, base_url FROM sources WHERE name = :name",
                        new MapSqlParameterSource("name", name), SOURCE_ROW)
                .stream()
                .findFirst();
    }

    private static boolean detectPostgres(NamedParameterJdbcTemplate jdbc) {
        if (jdbc.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbc.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            String product = metaData == null ? null : metaData.getDatabaseProductName();
            return product != null && product.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (SQLException e) {
            log.warn("Unable to detect database product; using standard MERGE for upserts", e);
            return false;
        }
    }
}
