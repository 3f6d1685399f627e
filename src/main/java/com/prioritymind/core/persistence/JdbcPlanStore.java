package com.prioritymind.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prioritymind.core.model.PlanSession;
import com.prioritymind.core.model.Reflection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link PlanStore} persisting JSON documents to SQL tables.
 * <p>
 * Sessions, reflections and task embeddings are each stored as one JSON
 * column keyed by session id. Upserts are written as update-then-insert inside
 * a transaction so they run on any SQL dialect. Tables are created by
 * {@link #createTables()}.
 */
public class JdbcPlanStore implements PlanStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcPlanStore.class);

    private static final String CREATE_SESSIONS_SQL = """
            CREATE TABLE IF NOT EXISTS plan_sessions (
                session_id VARCHAR(255) NOT NULL PRIMARY KEY,
                payload    TEXT NOT NULL,
                updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """;

    private static final String CREATE_REFLECTIONS_SQL = """
            CREATE TABLE IF NOT EXISTS reflections (
                session_id    VARCHAR(255) NOT NULL,
                reflection_id VARCHAR(255) NOT NULL,
                seq           INTEGER NOT NULL,
                payload       TEXT NOT NULL,
                PRIMARY KEY (session_id, reflection_id)
            )
            """;

    private static final String CREATE_EMBEDDINGS_SQL = """
            CREATE TABLE IF NOT EXISTS task_embeddings (
                session_id VARCHAR(255) NOT NULL,
                task_id    VARCHAR(255) NOT NULL,
                embedding  TEXT NOT NULL,
                PRIMARY KEY (session_id, task_id)
            )
            """;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;

    public JdbcPlanStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                         ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
    }

    public void createTables() {
        jdbcTemplate.execute(CREATE_SESSIONS_SQL);
        jdbcTemplate.execute(CREATE_REFLECTIONS_SQL);
        jdbcTemplate.execute(CREATE_EMBEDDINGS_SQL);
        log.info("Plan store tables ready");
    }

    @Override
    public Optional<PlanSession> findSession(String sessionId) {
        List<String> rows = jdbcTemplate.queryForList(
                "SELECT payload FROM plan_sessions WHERE session_id = ?", String.class, sessionId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(read(rows.get(0), PlanSession.class));
    }

    @Override
    public void saveSession(PlanSession session) {
        String payload = write(session);
        transactionTemplate.executeWithoutResult(status -> {
            int updated = jdbcTemplate.update(
                    "UPDATE plan_sessions SET payload = ?, updated_at = CURRENT_TIMESTAMP WHERE session_id = ?",
                    payload, session.sessionId());
            if (updated == 0) {
                jdbcTemplate.update("INSERT INTO plan_sessions (session_id, payload) VALUES (?, ?)",
                        session.sessionId(), payload);
            }
        });
        log.debug("Saved session {}", session.sessionId());
    }

    @Override
    public List<Reflection> findReflections(String sessionId) {
        return jdbcTemplate.queryForList(
                        "SELECT payload FROM reflections WHERE session_id = ? ORDER BY seq ASC",
                        String.class, sessionId)
                .stream()
                .map(json -> read(json, Reflection.class))
                .toList();
    }

    @Override
    public void saveReflection(String sessionId, Reflection reflection) {
        String payload = write(reflection);
        transactionTemplate.executeWithoutResult(status -> {
            int updated = jdbcTemplate.update(
                    "UPDATE reflections SET payload = ? WHERE session_id = ? AND reflection_id = ?",
                    payload, sessionId, reflection.id());
            if (updated == 0) {
                jdbcTemplate.update("""
                        INSERT INTO reflections (session_id, reflection_id, seq, payload)
                        VALUES (?, ?, (SELECT COALESCE(MAX(seq), 0) + 1 FROM reflections WHERE session_id = ?), ?)
                        """, sessionId, reflection.id(), sessionId, payload);
            }
        });
    }

    @Override
    public Map<String, float[]> findTaskEmbeddings(String sessionId) {
        var result = new HashMap<String, float[]>();
        jdbcTemplate.query("SELECT task_id, embedding FROM task_embeddings WHERE session_id = ?",
                rs -> {
                    result.put(rs.getString("task_id"), read(rs.getString("embedding"), float[].class));
                },
                sessionId);
        return result;
    }

    @Override
    public void saveTaskEmbeddings(String sessionId, Map<String, float[]> embeddings) {
        transactionTemplate.executeWithoutResult(status -> embeddings.forEach((taskId, vector) -> {
            String json = write(vector);
            int updated = jdbcTemplate.update(
                    "UPDATE task_embeddings SET embedding = ? WHERE session_id = ? AND task_id = ?",
                    json, sessionId, taskId);
            if (updated == 0) {
                jdbcTemplate.update("INSERT INTO task_embeddings (session_id, task_id, embedding) VALUES (?, ?, ?)",
                        sessionId, taskId, json);
            }
        }));
        log.debug("Saved {} task embedding(s) for session {}", embeddings.size(), sessionId);
    }

    @Override
    public void deleteTaskEmbeddings(String sessionId, Collection<String> taskIds) {
        transactionTemplate.executeWithoutResult(status -> taskIds.forEach(taskId ->
                jdbcTemplate.update("DELETE FROM task_embeddings WHERE session_id = ? AND task_id = ?",
                        sessionId, taskId)));
        log.debug("Dropped {} task embedding(s) for session {}", taskIds.size(), sessionId);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
