package com.dollarstore.exchangeapi.outbox;

import com.dollarstore.infra.kafka.contract.EventEnvelope;
import com.dollarstore.infra.kafka.producer.EventPublisher;
import com.dollarstore.infra.kafka.serde.EventEnvelopeJsonCodec;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/** Relays committed outbox rows to Kafka, keeping the row id as the event id. */
@Service
@ConditionalOnProperty(
    prefix = "outbox.publisher",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class OutboxPublisherService {
  private static final Logger log = LoggerFactory.getLogger(OutboxPublisherService.class);

  private final OutboxRepository outboxRepository;
  private final EventPublisher eventPublisher;
  private final OutboxPublisherProperties properties;
  private final EventEnvelopeJsonCodec codec;
  private final Clock clock;

  public OutboxPublisherService(
      OutboxRepository outboxRepository,
      EventPublisher eventPublisher,
      OutboxPublisherProperties properties,
      EventEnvelopeJsonCodec codec,
      Clock clock) {
    this.outboxRepository = outboxRepository;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
    this.codec = codec;
    this.clock = clock;
  }

  @Scheduled(fixedDelayString = "${outbox.publisher.fixed-delay-ms:1000}")
  public void publishPendingEvents() {
    List<OutboxEventRecord> claimed = outboxRepository.claimBatch(properties.getBatchSize());
    for (OutboxEventRecord record : claimed) {
      relay(record);
    }
  }

  private void relay(OutboxEventRecord record) {
    String key = messageKeyFor(record);
    try {
      JsonNode payload = codec.readPayload(record.eventPayload());
      EventEnvelope<JsonNode> envelope =
          EventEnvelope.of(
              record.id(),
              record.eventType(),
              1,
              record.createdAt(),
              properties.getProducerName(),
              record.id().toString(),
              key,
              payload);

      eventPublisher.publish(record.topic(), key, envelope).join();
      outboxRepository.markPublished(record.id(), clock.instant());

      log.info(
          "Outbox publish success outbox_id={} topic={} event_type={} key={} attempt_count={}",
          record.id(),
          record.topic(),
          record.eventType(),
          key,
          record.attemptCount());
    } catch (RuntimeException ex) {
      String error = errorMessage(ex);
      outboxRepository.markFailed(record.id(), error);
      log.warn(
          "Outbox publish failed outbox_id={} topic={} event_type={} attempt_count={} error={}",
          record.id(),
          record.topic(),
          record.eventType(),
          record.attemptCount() + 1,
          error);
    }
  }

  private static String messageKeyFor(OutboxEventRecord record) {
    if (record.eventKey() != null && !record.eventKey().isBlank()) {
      return record.eventKey();
    }
    if (record.aggregateId() != null && !record.aggregateId().isBlank()) {
      return record.aggregateId();
    }
    return record.id().toString();
  }

  private static String errorMessage(Throwable ex) {
    Throwable root = ex.getCause() != null ? ex.getCause() : ex;
    String message = root.getMessage();
    if (message == null || message.isBlank()) {
      return root.getClass().getSimpleName();
    }
    return message;
  }
}
