package com.hivemind.core.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hivemind.core.error.PatternStoreException;
import com.hivemind.core.model.AgentRole;
import com.hivemind.core.model.Decision;
import com.hivemind.core.model.Pattern;
import com.hivemind.core.model.PatternStoreStats;
import com.hivemind.core.model.TaskHistoryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * JDBC-backed {@link PatternStore} (PostgreSQL in production, H2 in tests).
 * <p>
 * Three tables are created by {@link #createTables()}: a key-value table for JSON
 * documents, an append-only pattern observation table and the task history.
 */
public class JdbcPatternStore implements PatternStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcPatternStore.class);

    private static final String CREATE_MEMORY_SQL = """
            CREATE TABLE IF NOT EXISTS hivemind_memory (
                memory_key   VARCHAR(255) NOT NULL PRIMARY KEY,
                memory_value TEXT NOT NULL,
                updated_at   TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """;

    private static final String CREATE_PATTERNS_SQL = """
            CREATE TABLE IF NOT EXISTS hivemind_patterns (
                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                task_type       VARCHAR(64) NOT NULL,
                agent_sequence  VARCHAR(1024) NOT NULL,
                success_rate    DOUBLE PRECISION NOT NULL,
                avg_duration_ms BIGINT NOT NULL,
                last_used       TIMESTAMP NOT NULL
            )
            """;

    private static final String CREATE_HISTORY_SQL = """
            CREATE TABLE IF NOT EXISTS hivemind_task_history (
                id           BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                objective_id VARCHAR(64) NOT NULL,
                objective    TEXT,
                task_type    VARCHAR(64) NOT NULL,
                agents_used  VARCHAR(1024) NOT NULL,
                success      BOOLEAN NOT NULL,
                duration_ms  BIGINT NOT NULL,
                completed_at TIMESTAMP NOT NULL
            )
            """;

    private static final String DELETE_ENTRY_SQL = "DELETE FROM hivemind_memory WHERE memory_key = ?";

    private static final String INSERT_ENTRY_SQL = """
            INSERT INTO hivemind_memory (memory_key, memory_value, updated_at) VALUES (?, ?, ?)
            """;

    private static final String SELECT_ENTRY_SQL = "SELECT memory_value FROM hivemind_memory WHERE memory_key = ?";

    private static final String INSERT_PATTERN_SQL = """
            INSERT INTO hivemind_patterns (task_type, agent_sequence, success_rate, avg_duration_ms, last_used)
            VALUES (?, ?, ?, ?, ?)
            """;

    private static final String SELECT_LATEST_PATTERNS_SQL = """
            SELECT p.task_type, p.agent_sequence, p.success_rate, p.avg_duration_ms, p.last_used,
                   (SELECT COUNT(*) FROM hivemind_patterns c WHERE c.task_type = p.task_type) AS use_count
            FROM hivemind_patterns p
            WHERE p.id IN (SELECT MAX(id) FROM hivemind_patterns GROUP BY task_type)
            ORDER BY p.task_type
            """;

    private static final String INSERT_HISTORY_SQL = """
            INSERT INTO hivemind_task_history
                (objective_id, objective, task_type, agents_used, success, duration_ms, completed_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_RECENT_OUTCOMES_SQL = """
            SELECT success FROM hivemind_task_history
            WHERE task_type = ?
            ORDER BY id DESC
            LIMIT ?
            """;

    private static final String COUNT_ENTRIES_SQL = "SELECT COUNT(*) FROM hivemind_memory";

    private static final String COUNT_HISTORY_SQL = """
            SELECT COUNT(*), COALESCE(SUM(CASE WHEN success THEN 1 ELSE 0 END), 0) FROM hivemind_task_history
            """;

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final int historyLimit;
    private final int similarLimit;
    private final AtomicLong decisionSequence = new AtomicLong();

    public JdbcPatternStore(DataSource dataSource, ObjectMapper objectMapper, int historyLimit, int similarLimit) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
        this.historyLimit = historyLimit;
        this.similarLimit = similarLimit;
    }

    /**
     * Creates the pattern store tables if they do not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_MEMORY_SQL);
            stmt.execute(CREATE_PATTERNS_SQL);
            stmt.execute(CREATE_HISTORY_SQL);
            log.info("Pattern store tables ensured");
        }
    }

    @Override
    public void store(String key, Object value) {
        String json = toJson(value);
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (PreparedStatement delete = conn.prepareStatement(DELETE_ENTRY_SQL);
                 PreparedStatement insert = conn.prepareStatement(INSERT_ENTRY_SQL)) {
                delete.setString(1, key);
                delete.executeUpdate();
                insert.setString(1, key);
                insert.setString(2, json);
                insert.setTimestamp(3, Timestamp.from(Instant.now()));
                insert.executeUpdate();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
            log.debug("Stored memory entry '{}'", key);
        } catch (SQLException e) {
            throw new PatternStoreException("Failed to store memory entry '" + key + "'", e);
        }
    }

    @Override
    public Optional<JsonNode> get(String key) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ENTRY_SQL)) {
            stmt.setString(1, key);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(objectMapper.readTree(rs.getString(1)));
                }
            }
        } catch (SQLException | JsonProcessingException e) {
            log.error("Failed to read memory entry '{}'", key, e);
        }
        return Optional.empty();
    }

    @Override
    public void storePattern(Pattern pattern) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_PATTERN_SQL)) {
            stmt.setString(1, pattern.taskType());
            stmt.setString(2, joinRoles(pattern.agentSequence()));
            stmt.setDouble(3, pattern.successRate());
            stmt.setLong(4, pattern.avgDurationMs());
            stmt.setTimestamp(5, Timestamp.from(pattern.lastUsed() != null ? pattern.lastUsed() : Instant.now()));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new PatternStoreException("Failed to store pattern for '" + pattern.taskType() + "'", e);
        }
    }

    @Override
    public Optional<Pattern> findBestPattern(String taskType) {
        return latestPatterns().stream()
                .filter(p -> p.taskType().equals(taskType))
                .findFirst();
    }

    @Override
    public List<Pattern> findSimilarPatterns(String text) {
        return PatternMatching.rankSimilar(latestPatterns(), text, similarLimit);
    }

    @Override
    public void storeDecision(Decision decision) {
        store("decision_" + decision.timestamp().toEpochMilli() + "_" + decisionSequence.incrementAndGet(), decision);
    }

    @Override
    public void recordTaskCompletion(TaskHistoryEntry entry) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_HISTORY_SQL)) {
            stmt.setString(1, entry.objectiveId());
            stmt.setString(2, entry.objective());
            stmt.setString(3, entry.taskType());
            stmt.setString(4, joinRoles(entry.agentsUsed()));
            stmt.setBoolean(5, entry.success());
            stmt.setLong(6, entry.durationMs());
            stmt.setTimestamp(7, Timestamp.from(entry.completedAt()));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new PatternStoreException("Failed to record history for objective " + entry.objectiveId(), e);
        }
    }

    @Override
    public double successRate(String taskType) {
        int total = 0;
        int succeeded = 0;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_RECENT_OUTCOMES_SQL)) {
            stmt.setString(1, taskType);
            stmt.setInt(2, historyLimit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    total++;
                    if (rs.getBoolean(1)) {
                        succeeded++;
                    }
                }
            }
        } catch (SQLException e) {
            log.error("Failed to compute success rate for '{}'", taskType, e);
        }
        return total == 0 ? PatternMatching.DEFAULT_SUCCESS_RATE : (double) succeeded / total;
    }

    @Override
    public PatternStoreStats stats() {
        int entries = 0;
        int historyCount = 0;
        long succeeded = 0;
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            try (ResultSet rs = stmt.executeQuery(COUNT_ENTRIES_SQL)) {
                if (rs.next()) {
                    entries = rs.getInt(1);
                }
            }
            try (ResultSet rs = stmt.executeQuery(COUNT_HISTORY_SQL)) {
                if (rs.next()) {
                    historyCount = rs.getInt(1);
                    succeeded = rs.getLong(2);
                }
            }
        } catch (SQLException e) {
            log.error("Failed to read pattern store statistics", e);
        }
        double overall = historyCount == 0 ? 0.0 : (double) succeeded / historyCount;
        return new PatternStoreStats(entries, latestPatterns().size(), historyCount, overall);
    }

    private List<Pattern> latestPatterns() {
        List<Pattern> patterns = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_LATEST_PATTERNS_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                patterns.add(new Pattern(
                        rs.getString("task_type"),
                        splitRoles(rs.getString("agent_sequence")),
                        rs.getDouble("success_rate"),
                        rs.getLong("avg_duration_ms"),
                        rs.getTimestamp("last_used").toInstant(),
                        rs.getInt("use_count")));
            }
        } catch (SQLException e) {
            log.error("Failed to load patterns", e);
        }
        return patterns;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PatternStoreException("Failed to serialize memory value", e);
        }
    }

    private static String joinRoles(List<AgentRole> roles) {
        return roles.stream().map(AgentRole::tag).collect(Collectors.joining(","));
    }

    private static List<AgentRole> splitRoles(String joined) {
        if (joined == null || joined.isBlank()) {
            return List.of();
        }
        return Arrays.stream(joined.split(","))
                .map(AgentRole::fromTag)
                .flatMap(Optional::stream)
                .toList();
    }
}
