package com.dollarstore.infra.kafka.producer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.dollarstore.infra.kafka.contract.EventEnvelope;
import com.dollarstore.infra.kafka.contract.EventHeaders;
import com.dollarstore.infra.kafka.contract.EventTypes;
import com.dollarstore.infra.kafka.contract.payload.DepositedV1;
import com.dollarstore.infra.kafka.observability.NoOpKafkaTelemetry;
import com.dollarstore.infra.kafka.serde.EventEnvelopeJsonCodec;
import com.dollarstore.infra.kafka.serde.EventObjectMapperFactory;
import com.dollarstore.infra.kafka.topics.TopicNames;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

class KafkaEventPublisherTest {
  private KafkaTemplate<String, String> kafkaTemplate;
  private KafkaEventPublisher publisher;

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() {
    kafkaTemplate = mock(KafkaTemplate.class);
    EventEnvelopeJsonCodec codec = new EventEnvelopeJsonCodec(EventObjectMapperFactory.create());
    publisher =
        new KafkaEventPublisher(kafkaTemplate, codec, new NoOpKafkaTelemetry(), Duration.ZERO);
  }

  @Test
  void shouldPublishWithRequiredHeadersAndKey() throws Exception {
    ProducerRecord<String, String> resultRecord =
        new ProducerRecord<>(TopicNames.RESERVE_DEPOSITS_V1, "alice", "{}");
    when(kafkaTemplate.send(any(ProducerRecord.class)))
        .thenReturn(CompletableFuture.completedFuture(new SendResult<>(resultRecord, null)));
    EventEnvelope<DepositedV1> envelope = depositEnvelope();

    publisher.publish(TopicNames.RESERVE_DEPOSITS_V1, "alice", envelope).get();

    @SuppressWarnings("unchecked")
    ArgumentCaptor<ProducerRecord<String, String>> captor =
        ArgumentCaptor.forClass(ProducerRecord.class);
    verify(kafkaTemplate).send(captor.capture());
    ProducerRecord<String, String> actual = captor.getValue();

    assertEquals(TopicNames.RESERVE_DEPOSITS_V1, actual.topic());
    assertEquals("alice", actual.key());
    assertNotNull(actual.value());
    assertEquals(envelope.eventId().toString(), headerValue(actual, EventHeaders.X_EVENT_ID));
    assertEquals(EventTypes.DEPOSITED, headerValue(actual, EventHeaders.X_EVENT_TYPE));
    assertEquals("1", headerValue(actual, EventHeaders.X_EVENT_VERSION));
    assertEquals("corr-1", headerValue(actual, EventHeaders.X_CORRELATION_ID));
    assertEquals(EventHeaders.APPLICATION_JSON, headerValue(actual, EventHeaders.CONTENT_TYPE));
  }

  @Test
  void shouldWrapPublishFailureWithKafkaPublishException() {
    CompletableFuture<SendResult<String, String>> failedFuture = new CompletableFuture<>();
    failedFuture.completeExceptionally(new IllegalStateException("broker unavailable"));
    when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(failedFuture);

    ExecutionException ex =
        assertThrows(
            ExecutionException.class,
            () ->
                publisher
                    .publish(TopicNames.RESERVE_DEPOSITS_V1, "alice", depositEnvelope())
                    .get());

    assertEquals(KafkaPublishException.class, ex.getCause().getClass());
    KafkaPublishException publishException = (KafkaPublishException) ex.getCause();
    assertEquals(TopicNames.RESERVE_DEPOSITS_V1, publishException.getTopic());
    assertEquals(EventTypes.DEPOSITED, publishException.getEventType());
  }

  @Test
  void shouldRejectInvalidTopicBeforeSending() {
    assertThrows(
        IllegalArgumentException.class,
        () -> publisher.publish("Reserve_Deposits", "alice", depositEnvelope()));
    verifyNoInteractions(kafkaTemplate);
  }

  private static EventEnvelope<DepositedV1> depositEnvelope() {
    return EventEnvelope.of(
        EventTypes.DEPOSITED,
        1,
        "exchange-api",
        "corr-1",
        "alice",
        new DepositedV1(
            "alice",
            "USDC",
            BigInteger.valueOf(1_000_000),
            new BigInteger("1000000000000000000"),
            Instant.parse("2026-03-01T12:00:00Z")));
  }

  private static String headerValue(ProducerRecord<String, String> record, String headerName) {
    Header header = record.headers().lastHeader(headerName);
    assertNotNull(header, "Expected header " + headerName + " to exist");
    return new String(header.value(), StandardCharsets.UTF_8);
  }
}
