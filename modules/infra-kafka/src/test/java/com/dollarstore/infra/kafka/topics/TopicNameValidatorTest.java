package com.dollarstore.infra.kafka.topics;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class TopicNameValidatorTest {
  @Test
  void shouldValidateAllKnownTopics() {
    for (String topic : TopicNames.all()) {
      assertDoesNotThrow(() -> TopicNameValidator.assertValid(topic));
      assertTrue(TopicNameValidator.isValid(topic));
    }
  }

  @Test
  void shouldRejectInvalidTopicNames() {
    assertFalse(TopicNameValidator.isValid("Queue.Positions.v1"));
    assertFalse(TopicNameValidator.isValid("queue_positions_v1"));
    assertFalse(TopicNameValidator.isValid("queue.positions"));
    assertFalse(TopicNameValidator.isValid("queue.positions.v0"));
    assertThrows(
        IllegalArgumentException.class, () -> TopicNameValidator.assertValid("queue.positions"));
  }
}
