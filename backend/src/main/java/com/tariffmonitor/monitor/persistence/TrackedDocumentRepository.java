package com.tariffmonitor.monitor.persistence;

import com.tariffmonitor.monitor.model.DocumentObservation;
import com.tariffmonitor.monitor.model.DocumentStatus;
import com.tariffmonitor.monitor.model.TrackedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

@Repository
public class TrackedDocumentRepository {
    private static final Logger log = LoggerFactory.getLogger(TrackedDocumentRepository.class);

    private static final String SELECT_COLUMNS = """
        SELECT id, utility_name, url, document_name, hash, last_checked,
               tariff_last_updated, status, link_text
        FROM tariff_documents
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public TrackedDocumentRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = detectPostgres(jdbc);
    }

    public TrackedDocument findByUrl(String url) {
        List<TrackedDocument> rows = jdbc.query(
            SELECT_COLUMNS + "WHERE url = :url",
            new MapSqlParameterSource("url", url),
            rowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<TrackedDocument> findBySource(String sourceName) {
        return jdbc.query(
            SELECT_COLUMNS + "WHERE utility_name = :sourceName ORDER BY id",
            new MapSqlParameterSource("sourceName", sourceName),
            rowMapper()
        );
    }

    public List<TrackedDocument> findActiveBySource(String sourceName) {
        return jdbc.query(
            SELECT_COLUMNS + "WHERE utility_name = :sourceName AND status = 'ACTIVE' ORDER BY id",
            new MapSqlParameterSource("sourceName", sourceName),
            rowMapper()
        );
    }

    /**
     * Inserts a new {@code ACTIVE} row unless one already exists for the url.
     *
     * @return true when a row was inserted
     */
    public boolean insertIfAbsent(DocumentObservation observation) {
        MapSqlParameterSource params = observationParams(observation)
            .addValue("status", DocumentStatus.ACTIVE.name());
        if (postgres) {
            int inserted = jdbc.update(
                """
                    INSERT INTO tariff_documents (
                        utility_name, url, document_name, hash, last_checked,
                        tariff_last_updated, status, link_text
                    )
                    VALUES (
                        :sourceName, :url, :documentName, :hash, :lastChecked,
                        :contentUpdatedAt, :status, :linkText
                    )
                    ON CONFLICT (url) DO NOTHING
                    """,
                params
            );
            return inserted > 0;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO tariff_documents (
                        utility_name, url, document_name, hash, last_checked,
                        tariff_last_updated, status, link_text
                    )
                    VALUES (
                        :sourceName, :url, :documentName, :hash, :lastChecked,
                        :contentUpdatedAt, :status, :linkText
                    )
                    """,
                params
            );
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("Concurrent insert for {}; falling back to update", observation.url());
            return false;
        }
    }

    /**
     * Writes the observed state onto an existing row. Never touches {@code id},
     * {@code utility_name} or {@code status}.
     */
    public int updateObservation(long id, DocumentObservation observation, Instant contentUpdatedAt) {
        MapSqlParameterSource params = observationParams(observation)
            .addValue("id", id)
            .addValue("contentUpdatedAt", toTimestamp(contentUpdatedAt));
        return jdbc.update(
            """
                UPDATE tariff_documents
                SET hash = :hash,
                    last_checked = :lastChecked,
                    tariff_last_updated = :contentUpdatedAt,
                    document_name = COALESCE(:documentName, document_name),
                    link_text = COALESCE(:linkText, link_text)
                WHERE id = :id
                """,
            params
        );
    }

    public int updateStatus(String url, DocumentStatus status) {
        return jdbc.update(
            "UPDATE tariff_documents SET status = :status WHERE url = :url",
            new MapSqlParameterSource()
                .addValue("status", status.name())
                .addValue("url", url)
        );
    }

    public int markObsoleteForSourceExcept(String sourceName, Collection<String> keepUrls) {
        return jdbc.update(
            """
                UPDATE tariff_documents
                SET status = 'OBSOLETE'
                WHERE utility_name = :sourceName
                  AND status = 'ACTIVE'
                  AND url NOT IN (:keepUrls)
                """,
            new MapSqlParameterSource()
                .addValue("sourceName", sourceName)
                .addValue("keepUrls", keepUrls)
        );
    }

    public int activate(Collection<String> urls) {
        return jdbc.update(
            """
                UPDATE tariff_documents
                SET status = 'ACTIVE'
                WHERE url IN (:urls)
                  AND status <> 'ACTIVE'
                """,
            new MapSqlParameterSource("urls", urls)
        );
    }

    public long countByUrl(String url) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM tariff_documents WHERE url = :url",
            new MapSqlParameterSource("url", url),
            Long.class
        );
        return count == null ? 0 : count;
    }

    private MapSqlParameterSource observationParams(DocumentObservation observation) {
        return new MapSqlParameterSource()
            .addValue("sourceName", observation.sourceName())
            .addValue("url", observation.url())
            .addValue("documentName", observation.displayName())
            .addValue("hash", observation.fingerprint())
            .addValue("lastChecked", toTimestamp(observation.checkedAt()))
            .addValue("contentUpdatedAt", toTimestamp(observation.remoteModifiedAt()))
            .addValue("linkText", observation.linkContext());
    }

    private RowMapper<TrackedDocument> rowMapper() {
        return (rs, rowNum) -> new TrackedDocument(
            rs.getLong("id"),
            rs.getString("utility_name"),
            rs.getString("url"),
            rs.getString("document_name"),
            rs.getString("hash"),
            toInstant(rs.getTimestamp("last_checked")),
            toInstant(rs.getTimestamp("tariff_last_updated")),
            parseStatus(rs.getString("status")),
            rs.getString("link_text")
        );
    }

    private DocumentStatus parseStatus(String raw) {
        if (raw == null || raw.isBlank()) {
            return DocumentStatus.ACTIVE;
        }
        try {
            return DocumentStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown status value in tariff_documents: {}", raw);
            return DocumentStatus.OBSOLETE;
        }
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; using portable insert", e);
            return false;
        }
    }
}
