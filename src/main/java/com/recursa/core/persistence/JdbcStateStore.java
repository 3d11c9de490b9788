package com.recursa.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-based {@link StateStore} that keeps one row per task in a PostgreSQL table.
 * <p>
 * Each persist is a single-row upsert of the whole JSON document, so the
 * database's statement atomicity gives the crash guarantee. The table
 * {@code recursa_task_state} is created by {@link #createTables()}.
 */
public class JdbcStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcStateStore.class);

    private static final String TABLE_NAME = "recursa_task_state";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                task_id    VARCHAR(255) NOT NULL PRIMARY KEY,
                version    BIGINT NOT NULL,
                state      TEXT NOT NULL,
                updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """.formatted(TABLE_NAME);

    private static final String UPSERT_SQL = """
            INSERT INTO %s (task_id, version, state, updated_at)
            VALUES (?, ?, ?, ?)
            ON CONFLICT (task_id)
            DO UPDATE SET version = EXCLUDED.version,
                          state = EXCLUDED.state,
                          updated_at = EXCLUDED.updated_at
            """.formatted(TABLE_NAME);

    private static final String SELECT_SQL = """
            SELECT state FROM %s WHERE task_id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_ALL_TASKS_SQL = """
            SELECT task_id FROM %s ORDER BY task_id
            """.formatted(TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE task_id = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final StateDocumentMapper mapper;

    public JdbcStateStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.mapper = new StateDocumentMapper();
    }

    /**
     * Creates the state table if it does not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Task state table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void persist(String taskId, PersistedTaskState state) {
        String json = mapper.write(state);
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
            stmt.setString(1, taskId);
            stmt.setLong(2, state.version());
            stmt.setString(3, json);
            stmt.setTimestamp(4, Timestamp.from(state.updatedAt()));
            stmt.executeUpdate();
            log.debug("Saved state v{} for task '{}'", state.version(), taskId);
        } catch (SQLException e) {
            throw new StateStoreException("Failed to persist state of task " + taskId, e);
        }
    }

    @Override
    public Optional<PersistedTaskState> load(String taskId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            stmt.setString(1, taskId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapper.read(rs.getString("state")));
                }
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to load state of task " + taskId, e);
        }
        return Optional.empty();
    }

    /**
     * Returns all task ids stored in the table.
     * Used by the CLI history command.
     */
    @Override
    public List<String> listTaskIds() {
        List<String> taskIds = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_TASKS_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                taskIds.add(rs.getString("task_id"));
            }
        } catch (SQLException e) {
            log.error("Failed to list task ids", e);
        }
        return taskIds;
    }

    @Override
    public void delete(String taskId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_SQL)) {
            stmt.setString(1, taskId);
            int deleted = stmt.executeUpdate();
            log.debug("Deleted {} state row(s) for task '{}'", deleted, taskId);
        } catch (SQLException e) {
            throw new StateStoreException("Failed to delete state of task " + taskId, e);
        }
    }
}
