package com.dcruver.filetaxonomy.persistence;

import com.dcruver.filetaxonomy.analysis.DeepAnalysisTask;
import com.dcruver.filetaxonomy.analysis.TaskStatus;
import com.dcruver.filetaxonomy.domain.TaxonomySnapshot;
import com.dcruver.filetaxonomy.domain.TaxonomyTree;
import com.dcruver.filetaxonomy.gate.MergeSuggestion;
import com.dcruver.filetaxonomy.gate.SplitSuggestion;
import com.dcruver.filetaxonomy.gate.SuggestionStatus;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import jakarta.annotation.PostConstruct;
import javax.sql.DataSource;
import java.io.IOException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Stores taxonomy snapshots, the deep-analysis ledger and structural suggestions in SQLite.
 * Trees are kept as JSON {@link TaxonomySnapshot}s.
 */
@Repository
@Slf4j
public class JdbcTaxonomyRepository implements TaxonomyRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcTaxonomyRepository(DataSource dataSource, ObjectMapper objectMapper) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS taxonomy_snapshots (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                name TEXT NOT NULL,
                created_at INTEGER NOT NULL,
                category_count INTEGER NOT NULL,
                file_count INTEGER NOT NULL,
                snapshot_json TEXT NOT NULL
            )
            """);

        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_snapshot_name
            ON taxonomy_snapshots(name, id)
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS task_ledger (
                task_id TEXT PRIMARY KEY,
                file_id TEXT NOT NULL,
                file_path TEXT,
                status TEXT NOT NULL,
                attempt INTEGER NOT NULL,
                error TEXT,
                result_path_json TEXT,
                result_confidence REAL,
                completed_at INTEGER
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS suggestions (
                id TEXT PRIMARY KEY,
                kind TEXT NOT NULL,
                status TEXT NOT NULL,
                reason TEXT,
                payload_json TEXT NOT NULL,
                created_at INTEGER NOT NULL
            )
            """);

        log.info("Initialized taxonomy repository");
    }

    @Override
    public void saveTree(String name, TaxonomyTree tree) {
        try {
            String json = objectMapper.writeValueAsString(TaxonomySnapshot.of(tree));
            jdbcTemplate.update(
                "INSERT INTO taxonomy_snapshots (name, created_at, category_count, file_count, snapshot_json) " +
                "VALUES (?, ?, ?, ?, ?)",
                name, Instant.now().toEpochMilli(), tree.categoryCount(), tree.totalFileCount(), json
            );
            log.debug("Saved snapshot of taxonomy '{}'", name);
        } catch (Exception e) {
            log.error("Failed to save taxonomy '{}'", name, e);
        }
    }

    @Override
    public Optional<TaxonomyTree> loadLatestTree(String name) {
        try {
            List<String> results = jdbcTemplate.query(
                "SELECT snapshot_json FROM taxonomy_snapshots WHERE name = ? ORDER BY id DESC LIMIT 1",
                (rs, rowNum) -> rs.getString("snapshot_json"),
                name
            );
            if (results.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(results.get(0), TaxonomySnapshot.class).toTree());
        } catch (Exception e) {
            log.error("Failed to load taxonomy '{}'", name, e);
            return Optional.empty();
        }
    }

    @Override
    public void saveTaskLedger(List<DeepAnalysisTask> tasks) {
        for (DeepAnalysisTask task : tasks) {
            try {
                String resultPath = task.getResult() != null
                    ? objectMapper.writeValueAsString(task.getResult().getCategoryPath())
                    : null;
                Double resultConfidence = task.getResult() != null ? task.getResult().getConfidence() : null;
                Long completedAt = task.getCompletedAt() != null ? task.getCompletedAt().toEpochMilli() : null;

                jdbcTemplate.update(
                    "INSERT OR REPLACE INTO task_ledger (task_id, file_id, file_path, status, attempt, error, " +
                    "result_path_json, result_confidence, completed_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    task.getId().toString(), task.getFileId().toString(), task.getFile().getPath(),
                    task.getStatus().name(), task.getAttempt(), task.getError(), resultPath, resultConfidence,
                    completedAt
                );
            } catch (Exception e) {
                log.error("Failed to record task {}", task.getId(), e);
            }
        }
        log.debug("Recorded {} tasks in the ledger", tasks.size());
    }

    @Override
    public List<TaskLedgerEntry> loadTaskLedger() {
        return jdbcTemplate.query(
            "SELECT * FROM task_ledger ORDER BY completed_at",
            new LedgerRowMapper()
        );
    }

    @Override
    public void saveSuggestions(List<MergeSuggestion> merges, List<SplitSuggestion> splits) {
        for (MergeSuggestion merge : merges) {
            saveSuggestion(merge.getId(), StoredSuggestion.MERGE, merge.getStatus(), merge.getReason(),
                merge, merge.getCreatedAt());
        }
        for (SplitSuggestion split : splits) {
            saveSuggestion(split.getId(), StoredSuggestion.SPLIT, split.getStatus(), split.getReason(),
                split, split.getCreatedAt());
        }
    }

    @Override
    public List<StoredSuggestion> loadSuggestions() {
        return jdbcTemplate.query(
            "SELECT * FROM suggestions ORDER BY created_at",
            (rs, rowNum) -> new StoredSuggestion(
                UUID.fromString(rs.getString("id")),
                rs.getString("kind"),
                SuggestionStatus.valueOf(rs.getString("status")),
                rs.getString("reason"),
                rs.getString("payload_json"),
                Instant.ofEpochMilli(rs.getLong("created_at"))
            )
        );
    }

    private void saveSuggestion(UUID id, String kind, SuggestionStatus status, String reason, Object payload,
                                Instant createdAt) {
        try {
            jdbcTemplate.update(
                "INSERT OR REPLACE INTO suggestions (id, kind, status, reason, payload_json, created_at) " +
                "VALUES (?, ?, ?, ?, ?, ?)",
                id.toString(), kind, status.name(), reason, objectMapper.writeValueAsString(payload),
                (createdAt != null ? createdAt : Instant.now()).toEpochMilli()
            );
        } catch (Exception e) {
            log.error("Failed to save {} suggestion {}", kind, id, e);
        }
    }

    private class LedgerRowMapper implements RowMapper<TaskLedgerEntry> {
        @Override
        public TaskLedgerEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                String resultPath = rs.getString("result_path_json");
                double confidence = rs.getDouble("result_confidence");
                boolean hasConfidence = !rs.wasNull();
                long completedAt = rs.getLong("completed_at");
                boolean hasCompletedAt = !rs.wasNull();

                return TaskLedgerEntry.builder()
                    .taskId(UUID.fromString(rs.getString("task_id")))
                    .fileId(UUID.fromString(rs.getString("file_id")))
                    .filePath(rs.getString("file_path"))
                    .status(TaskStatus.valueOf(rs.getString("status")))
                    .attempt(rs.getInt("attempt"))
                    .error(rs.getString("error"))
                    .resultPath(resultPath != null
                        ? objectMapper.readValue(resultPath, new TypeReference<List<String>>() {})
                        : List.of())
                    .resultConfidence(hasConfidence ? confidence : null)
                    .completedAt(hasCompletedAt ? Instant.ofEpochMilli(completedAt) : null)
                    .build();
            } catch (IOException e) {
                throw new SQLException("Failed to parse ledger entry", e);
            }
        }
    }
}
