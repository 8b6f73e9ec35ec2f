package com.dollarstore.exchangeapi.outbox;

import com.dollarstore.exchangeapi.engine.ExchangeEvent;
import com.dollarstore.infra.kafka.serde.EventEnvelopeJsonCodec;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcOutboxAppendRepository implements OutboxAppendRepository {
  private final JdbcTemplate jdbcTemplate;
  private final EventEnvelopeJsonCodec codec;

  public JdbcOutboxAppendRepository(JdbcTemplate jdbcTemplate, EventEnvelopeJsonCodec codec) {
    this.jdbcTemplate = jdbcTemplate;
    this.codec = codec;
  }

  @Override
  public void append(ExchangeEvent event) {
    String sql =
        """
        INSERT INTO outbox_events (
            id,
            aggregate_type,
            aggregate_id,
            event_type,
            event_payload,
            topic,
            event_key,
            status,
            attempt_count,
            created_at
        ) VALUES (?, ?, ?, ?, CAST(? AS JSONB), ?, ?, 'NEW', 0, NOW())
        """;
    jdbcTemplate.update(
        sql,
        UUID.randomUUID(),
        event.aggregateType(),
        event.aggregateId(),
        event.eventType(),
        codec.encodePayload(event.payload()),
        event.topic(),
        event.aggregateId());
  }
}
