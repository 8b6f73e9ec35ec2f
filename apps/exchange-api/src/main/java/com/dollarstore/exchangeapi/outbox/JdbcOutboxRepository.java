package com.dollarstore.exchangeapi.outbox;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class JdbcOutboxRepository implements OutboxRepository {
  private final JdbcTemplate jdbcTemplate;
  private final OutboxPublisherProperties properties;

  public JdbcOutboxRepository(JdbcTemplate jdbcTemplate, OutboxPublisherProperties properties) {
    this.jdbcTemplate = jdbcTemplate;
    this.properties = properties;
  }

  @Override
  @Transactional
  public List<OutboxEventRecord> claimBatch(int limit) {
    releaseExpiredLeases();

    String sql =
        """
        WITH due AS (
            SELECT id
            FROM outbox_events
            WHERE status IN ('NEW', 'FAILED')
              AND next_attempt_at <= NOW()
            ORDER BY sequence_no ASC
            FOR UPDATE SKIP LOCKED
            LIMIT ?
        )
        UPDATE outbox_events e
        SET status = 'PROCESSING',
            processing_started_at = NOW()
        FROM due
        WHERE e.id = due.id
        RETURNING e.id,
                  e.sequence_no,
                  e.aggregate_type,
                  e.aggregate_id,
                  e.event_type,
                  e.event_payload,
                  e.topic,
                  e.event_key,
                  e.attempt_count,
                  e.created_at
        """;
    List<OutboxEventRecord> claimed =
        jdbcTemplate.query(sql, JdbcOutboxRepository::mapRecord, Math.max(1, limit));
    // RETURNING does not preserve the CTE order
    return claimed.stream()
        .sorted(Comparator.comparingLong(OutboxEventRecord::sequenceNo))
        .toList();
  }

  @Override
  public void markPublished(UUID id, Instant publishedAt) {
    String sql =
        """
        UPDATE outbox_events
        SET status = 'PUBLISHED',
            published_at = ?,
            processing_started_at = NULL,
            last_error = NULL
        WHERE id = ?
        """;
    jdbcTemplate.update(sql, Timestamp.from(publishedAt), id);
  }

  @Override
  public void markFailed(UUID id, String errorMessage) {
    String sql =
        """
        UPDATE outbox_events
        SET attempt_count = attempt_count + 1,
            status = CASE WHEN attempt_count + 1 >= ? THEN 'DEAD' ELSE 'FAILED' END,
            next_attempt_at = CASE
                WHEN attempt_count + 1 >= ? THEN next_attempt_at
                ELSE NOW() + INTERVAL '5 seconds' * POWER(2, LEAST(attempt_count + 1, 6))
            END,
            processing_started_at = NULL,
            last_error = ?
        WHERE id = ?
        """;
    int maxAttempts = Math.max(1, properties.getMaxAttempts());
    jdbcTemplate.update(sql, maxAttempts, maxAttempts, errorMessage, id);
  }

  private void releaseExpiredLeases() {
    String sql =
        """
        UPDATE outbox_events
        SET status = 'FAILED',
            next_attempt_at = NOW(),
            processing_started_at = NULL,
            last_error = COALESCE(last_error, 'Processing lease expired')
        WHERE status = 'PROCESSING'
          AND processing_started_at < NOW() - make_interval(secs => ?)
        """;
    jdbcTemplate.update(sql, (double) Math.max(1L, properties.getLeaseTimeoutSeconds()));
  }

  private static OutboxEventRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
    return new OutboxEventRecord(
        rs.getObject("id", UUID.class),
        rs.getLong("sequence_no"),
        rs.getString("aggregate_type"),
        rs.getString("aggregate_id"),
        rs.getString("event_type"),
        rs.getString("event_payload"),
        rs.getString("topic"),
        rs.getString("event_key"),
        rs.getInt("attempt_count"),
        rs.getTimestamp("created_at").toInstant());
  }
}
