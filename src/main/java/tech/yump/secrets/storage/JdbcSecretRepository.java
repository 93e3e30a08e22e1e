package tech.yump.secrets.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import tech.yump.secrets.secrets.SecretRecord;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcSecretRepository implements SecretRepository {

    private static final TypeReference<Map<String, Object>> SECRET_TYPE = new TypeReference<>() {};

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS secrets (
                id UUID PRIMARY KEY,
                name VARCHAR(256) NOT NULL,
                secret VARCHAR NOT NULL,
                is_vault BOOLEAN NOT NULL DEFAULT FALSE,
                is_byos_vault BOOLEAN NOT NULL DEFAULT FALSE,
                created_at TIMESTAMP WITH TIME ZONE NOT NULL,
                updated_at TIMESTAMP WITH TIME ZONE NOT NULL
            )""";

    private static final String INSERT_SQL =
            "INSERT INTO secrets (id, name, secret, is_vault, is_byos_vault, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?)";
    private static final String SELECT_BY_ID_SQL =
            "SELECT id, name, secret, is_vault, is_byos_vault, created_at, updated_at FROM secrets WHERE id = ?";
    private static final String UPDATE_SECRET_SQL =
            "UPDATE secrets SET secret = ?, updated_at = ? WHERE id = ?";
    private static final String UPDATE_SECRET_AND_BYOS_SQL =
            "UPDATE secrets SET secret = ?, is_byos_vault = ?, updated_at = ? WHERE id = ?";
    private static final String DELETE_SQL = "DELETE FROM secrets WHERE id = ?";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @PostConstruct
    public void initializeSchema() {
        log.info("Ensuring 'secrets' metadata table exists...");
        try {
            jdbcTemplate.execute(CREATE_TABLE_SQL);
        } catch (DataAccessException e) {
            log.error("Failed to create or verify the 'secrets' table: {}", e.getMessage(), e);
            throw new StorageException("Failed to initialize secrets metadata table", e);
        }
    }

    @Override
    public SecretRecord create(SecretRecord draft) {
        UUID id = UUID.randomUUID();
        Instant now = now();
        SecretRecord stored = draft.toBuilder().id(id).createdAt(now).updatedAt(now).build();
        try {
            jdbcTemplate.update(INSERT_SQL,
                    id,
                    stored.name(),
                    toJson(stored.secret()),
                    stored.isVault(),
                    stored.isByosVault(),
                    Timestamp.from(now),
                    Timestamp.from(now));
        } catch (DataAccessException e) {
            log.error("Failed to insert secret row '{}': {}", stored.name(), e.getMessage());
            throw new StorageException("Failed to create secret row", e);
        }
        log.debug("Created secret row {} (vault={}, byos={})", id, stored.isVault(), stored.isByosVault());
        return stored;
    }

    @Override
    public Optional<SecretRecord> findById(UUID id) {
        try {
            List<SecretRecord> rows = jdbcTemplate.query(SELECT_BY_ID_SQL, rowMapper(), id);
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            log.error("Failed to read secret row {}: {}", id, e.getMessage());
            throw new StorageException("Failed to read secret row", e);
        }
    }

    @Override
    public Optional<SecretRecord> update(UUID id, SecretUpdate update) {
        Timestamp now = Timestamp.from(now());
        int updated;
        try {
            if (update.byosVault() == null) {
                updated = jdbcTemplate.update(UPDATE_SECRET_SQL, toJson(update.secret()), now, id);
            } else {
                updated = jdbcTemplate.update(UPDATE_SECRET_AND_BYOS_SQL,
                        toJson(update.secret()), update.byosVault(), now, id);
            }
        } catch (DataAccessException e) {
            log.error("Failed to update secret row {}: {}", id, e.getMessage());
            throw new StorageException("Failed to update secret row", e);
        }
        if (updated == 0) {
            return Optional.empty();
        }
        return findById(id);
    }

    @Override
    public boolean delete(UUID id) {
        try {
            return jdbcTemplate.update(DELETE_SQL, id) > 0;
        } catch (DataAccessException e) {
            log.error("Failed to delete secret row {}: {}", id, e.getMessage());
            throw new StorageException("Failed to delete secret row", e);
        }
    }

    private RowMapper<SecretRecord> rowMapper() {
        return (ResultSet rs, int rowNum) -> SecretRecord.builder()
                .id(rs.getObject("id", UUID.class))
                .name(rs.getString("name"))
                .secret(fromJson(rs.getString("secret")))
                .isVault(rs.getBoolean("is_vault"))
                .isByosVault(rs.getBoolean("is_byos_vault"))
                .createdAt(toInstant(rs, "created_at"))
                .updatedAt(toInstant(rs, "updated_at"))
                .build();
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }

    // Postgres keeps microsecond precision
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private String toJson(Map<String, Object> secret) {
        try {
            return objectMapper.writeValueAsString(secret);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize secret column", e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, SECRET_TYPE);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to deserialize secret column", e);
        }
    }
}
