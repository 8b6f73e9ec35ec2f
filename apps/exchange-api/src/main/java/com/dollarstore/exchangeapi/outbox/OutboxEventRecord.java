package com.dollarstore.exchangeapi.outbox;

import java.time.Instant;
import java.util.UUID;

/** {@code sequenceNo} orders rows in the order they were appended to the outbox. */
public record OutboxEventRecord(
    UUID id,
    long sequenceNo,
    String aggregateType,
    String aggregateId,
    String eventType,
    String eventPayload,
    String topic,
    String eventKey,
    int attemptCount,
    Instant createdAt) {}
