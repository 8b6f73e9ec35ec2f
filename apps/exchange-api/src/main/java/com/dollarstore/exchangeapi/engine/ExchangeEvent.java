package com.dollarstore.exchangeapi.engine;

import java.util.Objects;

/** A domain event waiting to be written to the outbox when its operation commits. */
public record ExchangeEvent(
    String aggregateType, String aggregateId, String eventType, String topic, Object payload) {
  public ExchangeEvent {
    Objects.requireNonNull(aggregateType, "aggregateType must not be null");
    Objects.requireNonNull(aggregateId, "aggregateId must not be null");
    Objects.requireNonNull(eventType, "eventType must not be null");
    Objects.requireNonNull(topic, "topic must not be null");
    Objects.requireNonNull(payload, "payload must not be null");
  }
}
