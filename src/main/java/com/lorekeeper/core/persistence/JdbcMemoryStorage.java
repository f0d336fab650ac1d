package com.lorekeeper.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import com.lorekeeper.core.error.StorageFailureException;
import com.lorekeeper.core.model.BufferEntry;
import com.lorekeeper.core.model.BufferStatus;
import com.lorekeeper.core.model.CanonEntry;
import com.lorekeeper.core.model.DisputeRecord;
import com.lorekeeper.core.model.DisputeResolution;
import com.lorekeeper.core.model.DisputeStatus;
import com.lorekeeper.core.model.TaskMemory;
import com.lorekeeper.core.model.TaskMemoryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link MemoryStorage}.
 * <p>
 * Records are stored as JSON documents next to the columns that the compare-and-set
 * statements need ({@code status}, {@code version}, {@code archived}). Canon versions are
 * keyed by {@code (canon_key, version)}, so two writers racing for the same version can
 * never both succeed: the loser hits the primary key and gets {@code false}.
 * <p>
 * Tables are created by {@link #createTables()}. The SQL sticks to what PostgreSQL and H2
 * both accept.
 */
public class JdbcMemoryStorage implements MemoryStorage {

    private static final Logger log = LoggerFactory.getLogger(JdbcMemoryStorage.class);

    private static final List<String> CREATE_TABLES_SQL = List.of(
            """
            CREATE TABLE IF NOT EXISTS lk_canon (
                canon_key  VARCHAR(512) NOT NULL,
                version    BIGINT NOT NULL,
                entry      VARCHAR(100000) NOT NULL,
                PRIMARY KEY (canon_key, version)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS lk_buffer (
                seq      BIGINT GENERATED BY DEFAULT AS IDENTITY,
                id       VARCHAR(64) NOT NULL PRIMARY KEY,
                task_id  VARCHAR(255) NOT NULL,
                status   VARCHAR(32) NOT NULL,
                entry    VARCHAR(100000) NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS lk_disputes (
                seq        BIGINT GENERATED BY DEFAULT AS IDENTITY,
                id         VARCHAR(64) NOT NULL PRIMARY KEY,
                status     VARCHAR(32) NOT NULL,
                record     VARCHAR(100000) NOT NULL,
                resolution VARCHAR(100000)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS lk_tasks (
                task_id    VARCHAR(255) NOT NULL PRIMARY KEY,
                prompt     VARCHAR(100000),
                created_at VARCHAR(64) NOT NULL,
                archived   BOOLEAN NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS lk_task_entries (
                seq      BIGINT GENERATED BY DEFAULT AS IDENTITY,
                task_id  VARCHAR(255) NOT NULL,
                entry    VARCHAR(100000) NOT NULL
            )
            """
    );

    private static final String SELECT_CANON_CURRENT_SQL = """
            SELECT entry FROM lk_canon WHERE canon_key = ? ORDER BY version DESC LIMIT 1
            """;
    private static final String SELECT_CANON_ALL_SQL = """
            SELECT canon_key, version, entry FROM lk_canon ORDER BY canon_key, version
            """;
    private static final String SELECT_CANON_HISTORY_SQL = """
            SELECT entry FROM lk_canon WHERE canon_key = ? ORDER BY version ASC
            """;
    private static final String SELECT_CANON_MAX_VERSION_SQL = """
            SELECT MAX(version) FROM lk_canon WHERE canon_key = ?
            """;
    private static final String INSERT_CANON_SQL = """
            INSERT INTO lk_canon (canon_key, version, entry) VALUES (?, ?, ?)
            """;

    private static final String INSERT_BUFFER_SQL = """
            INSERT INTO lk_buffer (id, task_id, status, entry) VALUES (?, ?, ?, ?)
            """;
    private static final String SELECT_BUFFER_SQL = """
            SELECT status, entry FROM lk_buffer ORDER BY seq
            """;
    private static final String SELECT_BUFFER_BY_ID_SQL = """
            SELECT status, entry FROM lk_buffer WHERE id = ?
            """;
    private static final String UPDATE_BUFFER_STATUS_SQL = """
            UPDATE lk_buffer SET status = ? WHERE id = ? AND status = ?
            """;

    private static final String INSERT_DISPUTE_SQL = """
            INSERT INTO lk_disputes (id, status, record) VALUES (?, ?, ?)
            """;
    private static final String SELECT_DISPUTES_SQL = """
            SELECT record, resolution FROM lk_disputes ORDER BY seq
            """;
    private static final String SELECT_DISPUTE_BY_ID_SQL = """
            SELECT record, resolution FROM lk_disputes WHERE id = ?
            """;
    private static final String RESOLVE_DISPUTE_SQL = """
            UPDATE lk_disputes SET status = ?, resolution = ? WHERE id = ? AND status = ?
            """;

    private static final String INSERT_TASK_SQL = """
            INSERT INTO lk_tasks (task_id, prompt, created_at, archived) VALUES (?, ?, ?, FALSE)
            """;
    private static final String SELECT_TASK_SQL = """
            SELECT prompt, created_at, archived FROM lk_tasks WHERE task_id = ?
            """;
    private static final String SELECT_TASK_FOR_APPEND_SQL = """
            SELECT archived FROM lk_tasks WHERE task_id = ? FOR UPDATE
            """;
    private static final String SELECT_TASK_IDS_SQL = """
            SELECT task_id FROM lk_tasks ORDER BY created_at
            """;
    private static final String INSERT_TASK_ENTRY_SQL = """
            INSERT INTO lk_task_entries (task_id, entry) VALUES (?, ?)
            """;
    private static final String SELECT_TASK_ENTRIES_SQL = """
            SELECT entry FROM lk_task_entries WHERE task_id = ? ORDER BY seq
            """;
    private static final String ARCHIVE_TASK_SQL = """
            UPDATE lk_tasks SET archived = TRUE WHERE task_id = ? AND archived = FALSE
            """;

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcMemoryStorage(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new ParameterNamesModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Creates the memory tables if they do not already exist.
     * Should be called once during application startup.
     */
    public void createTables() {
        try (Connection conn = dataSource.getConnection()) {
            for (String sql : CREATE_TABLES_SQL) {
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    stmt.execute();
                }
            }
            log.info("Memory tables ensured");
        } catch (SQLException e) {
            throw new StorageFailureException("Failed to create memory tables", e);
        }
    }

    // ── Canon ─────────────────────────────────────────────────────────────

    @Override
    public Optional<CanonEntry> currentCanon(String key) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_CANON_CURRENT_SQL)) {
            stmt.setString(1, key);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(read(rs.getString("entry"), CanonEntry.class));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StorageFailureException("Failed to read canon key '" + key + "'", e);
        }
    }

    @Override
    public Map<String, CanonEntry> currentCanon() {
        var latest = new LinkedHashMap<String, CanonEntry>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_CANON_ALL_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                // ordered by version, so the last row per key wins
                latest.put(rs.getString("canon_key"), read(rs.getString("entry"), CanonEntry.class));
            }
            return latest;
        } catch (SQLException e) {
            throw new StorageFailureException("Failed to read canon", e);
        }
    }

    @Override
    public List<CanonEntry> canonHistory(String key) {
        var versions = new ArrayList<CanonEntry>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_CANON_HISTORY_SQL)) {
            stmt.setString(1, key);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    versions.add(read(rs.getString("entry"), CanonEntry.class));
                }
            }
            return versions;
        } catch (SQLException e) {
            throw new StorageFailureException("Failed to read canon history for '" + key + "'", e);
        }
    }

    @Override
    public boolean installCanon(CanonEntry entry) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                long current = 0;
                try (PreparedStatement stmt = conn.prepareStatement(SELECT_CANON_MAX_VERSION_SQL)) {
                    stmt.setString(1, entry.key());
                    try (ResultSet rs = stmt.executeQuery()) {
                        if (rs.next()) {
                            current = rs.getLong(1);
                        }
                    }
                }
                if (entry.version() != current + 1) {
                    conn.rollback();
                    return false;
                }
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_CANON_SQL)) {
                    stmt.setString(1, entry.key());
                    stmt.setLong(2, entry.version());
                    stmt.setString(3, write(entry));
                    stmt.executeUpdate();
                }
                conn.commit();
                log.debug("Installed canon '{}' v{}", entry.key(), entry.version());
                return true;
            } catch (SQLException e) {
                conn.rollback();
                if (isConstraintViolation(e)) {
                    log.debug("Lost canon install race for '{}' v{}", entry.key(), entry.version());
                    return false;
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new StorageFailureException("Failed to install canon '" + entry.key() + "'", e);
        }
    }

    // ── Buffer ────────────────────────────────────────────────────────────

    @Override
    public void appendBuffer(BufferEntry entry) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_BUFFER_SQL)) {
            stmt.setString(1, entry.id());
            stmt.setString(2, entry.taskId());
            stmt.setString(3, entry.status().name());
            stmt.setString(4, write(entry));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StorageFailureException("Failed to append buffer entry " + entry.id(), e);
        }
    }

    @Override
    public List<BufferEntry> buffer() {
        var entries = new ArrayList<BufferEntry>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BUFFER_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                entries.add(bufferFromRow(rs));
            }
            return entries;
        } catch (SQLException e) {
            throw new StorageFailureException("Failed to read buffer", e);
        }
    }

    @Override
    public Optional<BufferEntry> bufferEntry(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BUFFER_BY_ID_SQL)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(bufferFromRow(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageFailureException("Failed to read buffer entry " + id, e);
        }
    }

    @Override
    public boolean updateBufferStatus(String id, BufferStatus expected, BufferStatus next) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_BUFFER_STATUS_SQL)) {
            stmt.setString(1, next.name());
            stmt.setString(2, id);
            stmt.setString(3, expected.name());
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StorageFailureException("Failed to update buffer entry " + id, e);
        }
    }

    // ── Disputes ──────────────────────────────────────────────────────────

    @Override
    public void appendDispute(DisputeRecord record) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_DISPUTE_SQL)) {
            stmt.setString(1, record.id());
            stmt.setString(2, record.status().name());
            stmt.setString(3, write(record));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StorageFailureException("Failed to append dispute " + record.id(), e);
        }
    }

    @Override
    public List<DisputeRecord> disputes() {
        var records = new ArrayList<DisputeRecord>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_DISPUTES_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                records.add(disputeFromRow(rs));
            }
            return records;
        } catch (SQLException e) {
            throw new StorageFailureException("Failed to read disputes", e);
        }
    }

    @Override
    public Optional<DisputeRecord> dispute(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_DISPUTE_BY_ID_SQL)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(disputeFromRow(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageFailureException("Failed to read dispute " + id, e);
        }
    }

    @Override
    public boolean resolveDispute(String id, DisputeResolution resolution) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(RESOLVE_DISPUTE_SQL)) {
            stmt.setString(1, DisputeStatus.RESOLVED.name());
            stmt.setString(2, write(resolution));
            stmt.setString(3, id);
            stmt.setString(4, DisputeStatus.OPEN.name());
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StorageFailureException("Failed to resolve dispute " + id, e);
        }
    }

    // ── Task memory ───────────────────────────────────────────────────────

    @Override
    public boolean createTaskMemory(String taskId, String prompt, Instant createdAt) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_TASK_SQL)) {
            stmt.setString(1, taskId);
            stmt.setString(2, prompt);
            stmt.setString(3, createdAt.toString());
            stmt.executeUpdate();
            return true;
        } catch (SQLException e) {
            if (isConstraintViolation(e)) {
                return false;
            }
            throw new StorageFailureException("Failed to create task memory " + taskId, e);
        }
    }

    @Override
    public boolean appendTaskMemory(String taskId, TaskMemoryEntry entry) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement stmt = conn.prepareStatement(SELECT_TASK_FOR_APPEND_SQL)) {
                    stmt.setString(1, taskId);
                    try (ResultSet rs = stmt.executeQuery()) {
                        if (!rs.next() || rs.getBoolean("archived")) {
                            conn.rollback();
                            return false;
                        }
                    }
                }
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_TASK_ENTRY_SQL)) {
                    stmt.setString(1, taskId);
                    stmt.setString(2, write(entry));
                    stmt.executeUpdate();
                }
                conn.commit();
                return true;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StorageFailureException("Failed to append task memory for " + taskId, e);
        }
    }

    @Override
    public boolean archiveTaskMemory(String taskId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(ARCHIVE_TASK_SQL)) {
            stmt.setString(1, taskId);
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StorageFailureException("Failed to archive task memory " + taskId, e);
        }
    }

    @Override
    public Optional<TaskMemory> taskMemory(String taskId) {
        try (Connection conn = dataSource.getConnection()) {
            String prompt;
            Instant createdAt;
            boolean archived;
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_TASK_SQL)) {
                stmt.setString(1, taskId);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    prompt = rs.getString("prompt");
                    createdAt = Instant.parse(rs.getString("created_at"));
                    archived = rs.getBoolean("archived");
                }
            }
            var entries = new ArrayList<TaskMemoryEntry>();
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_TASK_ENTRIES_SQL)) {
                stmt.setString(1, taskId);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        entries.add(read(rs.getString("entry"), TaskMemoryEntry.class));
                    }
                }
            }
            return Optional.of(new TaskMemory(taskId, prompt, createdAt, entries, archived));
        } catch (SQLException e) {
            throw new StorageFailureException("Failed to read task memory " + taskId, e);
        }
    }

    @Override
    public List<String> taskIds() {
        var ids = new ArrayList<String>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_TASK_IDS_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getString("task_id"));
            }
            return ids;
        } catch (SQLException e) {
            throw new StorageFailureException("Failed to list task ids", e);
        }
    }

    @Override
    public String describe() {
        try (Connection conn = dataSource.getConnection()) {
            return "jdbc (" + conn.getMetaData().getDatabaseProductName() + ")";
        } catch (SQLException e) {
            throw new StorageFailureException("Database unavailable: " + e.getMessage(), e);
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private BufferEntry bufferFromRow(ResultSet rs) throws SQLException {
        BufferEntry stored = read(rs.getString("entry"), BufferEntry.class);
        return stored.withStatus(BufferStatus.valueOf(rs.getString("status")));
    }

    private DisputeRecord disputeFromRow(ResultSet rs) throws SQLException {
        DisputeRecord stored = read(rs.getString("record"), DisputeRecord.class);
        String resolution = rs.getString("resolution");
        return resolution == null ? stored : stored.resolve(read(resolution, DisputeResolution.class));
    }

    private static boolean isConstraintViolation(SQLException e) {
        String state = e.getSQLState();
        return state != null && state.startsWith("23");
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StorageFailureException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StorageFailureException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
