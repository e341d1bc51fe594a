package com.gateflow.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-based {@link StateStore} that keeps every record as one JSON row in a PostgreSQL table.
 * <p>
 * Each write is a single-row {@code INSERT ... ON CONFLICT DO UPDATE}, so concurrent readers
 * observe either the previous payload or the new one.
 * <p>
 * The table {@code gateflow_state} is created automatically via {@link #createTables()}.
 */
public class JdbcStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcStateStore.class);

    static final String TABLE_NAME = "gateflow_state";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                state_key  VARCHAR(255) PRIMARY KEY,
                payload    TEXT NOT NULL,
                updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """.formatted(TABLE_NAME);

    private static final String UPSERT_SQL = """
            INSERT INTO %s (state_key, payload)
            VALUES (?, ?)
            ON CONFLICT (state_key)
            DO UPDATE SET payload = EXCLUDED.payload,
                          updated_at = CURRENT_TIMESTAMP
            """.formatted(TABLE_NAME);

    private static final String SELECT_SQL = """
            SELECT payload FROM %s WHERE state_key = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_KEYS_SQL = """
            SELECT state_key FROM %s WHERE state_key LIKE ? ORDER BY state_key ASC
            """.formatted(TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE state_key = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcStateStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
    }

    /**
     * Creates the state table if it does not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("State table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void write(String key, Object value) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StateStoreException(key, "Failed to serialize state record", e);
        }
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
            stmt.setString(1, key);
            stmt.setString(2, json);
            stmt.executeUpdate();
            log.debug("Upserted state record {}", key);
        } catch (SQLException e) {
            throw new StateStoreException(key, "Failed to write state record", e);
        }
    }

    @Override
    public <T> Optional<T> read(String key, Class<T> type) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            stmt.setString(1, key);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(objectMapper.readValue(rs.getString("payload"), type));
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new StateStoreException(key, "Failed to read state record", e);
        }
    }

    @Override
    public boolean exists(String key) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            stmt.setString(1, key);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new StateStoreException(key, "Failed to look up state record", e);
        }
    }

    @Override
    public List<String> listKeys(String suffix) {
        List<String> keys = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_KEYS_SQL)) {
            stmt.setString(1, "%" + (suffix != null ? suffix : ""));
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    keys.add(rs.getString("state_key"));
                }
            }
        } catch (SQLException e) {
            throw new StateStoreException(TABLE_NAME, "Failed to list state records", e);
        }
        return keys;
    }

    @Override
    public void delete(String key) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_SQL)) {
            stmt.setString(1, key);
            int deleted = stmt.executeUpdate();
            log.debug("Deleted {} row(s) for state record {}", deleted, key);
        } catch (SQLException e) {
            throw new StateStoreException(key, "Failed to delete state record", e);
        }
    }
}
