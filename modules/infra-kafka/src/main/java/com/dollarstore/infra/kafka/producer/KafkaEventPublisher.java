package com.dollarstore.infra.kafka.producer;

import com.dollarstore.infra.kafka.contract.EventEnvelope;
import com.dollarstore.infra.kafka.contract.EventHeaders;
import com.dollarstore.infra.kafka.observability.KafkaTelemetry;
import com.dollarstore.infra.kafka.serde.EventEnvelopeJsonCodec;
import com.dollarstore.infra.kafka.topics.TopicNameValidator;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

public class KafkaEventPublisher implements EventPublisher {
  private final KafkaTemplate<String, String> kafkaTemplate;
  private final EventEnvelopeJsonCodec codec;
  private final KafkaTelemetry telemetry;
  private final Duration sendTimeout;

  public KafkaEventPublisher(
      KafkaTemplate<String, String> kafkaTemplate,
      EventEnvelopeJsonCodec codec,
      KafkaTelemetry telemetry) {
    this(kafkaTemplate, codec, telemetry, Duration.ZERO);
  }

  public KafkaEventPublisher(
      KafkaTemplate<String, String> kafkaTemplate,
      EventEnvelopeJsonCodec codec,
      KafkaTelemetry telemetry,
      Duration sendTimeout) {
    this.kafkaTemplate = kafkaTemplate;
    this.codec = codec;
    this.telemetry = telemetry;
    this.sendTimeout = sendTimeout == null ? Duration.ZERO : sendTimeout;
  }

  @Override
  public <T> CompletableFuture<SendResult<String, String>> publish(
      String topic, String key, EventEnvelope<T> envelope) {
    TopicNameValidator.assertValid(topic);
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("Kafka key must not be blank");
    }

    long started = System.nanoTime();
    ProducerRecord<String, String> record =
        new ProducerRecord<>(topic, key, codec.encode(envelope));
    addHeader(record, EventHeaders.X_EVENT_ID, envelope.eventId().toString());
    addHeader(record, EventHeaders.X_EVENT_TYPE, envelope.eventType());
    addHeader(record, EventHeaders.X_EVENT_VERSION, Integer.toString(envelope.eventVersion()));
    addHeader(record, EventHeaders.X_CORRELATION_ID, envelope.correlationId());
    addHeader(record, EventHeaders.CONTENT_TYPE, EventHeaders.APPLICATION_JSON);

    CompletableFuture<SendResult<String, String>> result = new CompletableFuture<>();
    withTimeout(kafkaTemplate.send(record))
        .whenComplete(
            (sendResult, throwable) -> {
              if (throwable == null) {
                telemetry.onPublishSuccess(
                    topic, key, envelope.eventType(), System.nanoTime() - started);
                result.complete(sendResult);
                return;
              }
              KafkaPublishException publishException =
                  toPublishException(topic, key, envelope.eventType(), throwable);
              telemetry.onPublishFailure(topic, key, envelope.eventType(), publishException);
              result.completeExceptionally(publishException);
            });
    return result;
  }

  private CompletableFuture<SendResult<String, String>> withTimeout(
      CompletableFuture<SendResult<String, String>> sendFuture) {
    if (sendTimeout.isZero() || sendTimeout.isNegative()) {
      return sendFuture;
    }
    return sendFuture.orTimeout(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  private static KafkaPublishException toPublishException(
      String topic, String key, String eventType, Throwable throwable) {
    Throwable cause = throwable;
    if (throwable instanceof CompletionException completionException
        && completionException.getCause() != null) {
      cause = completionException.getCause();
    }
    if (cause instanceof KafkaPublishException existing) {
      return existing;
    }
    String prefix = cause instanceof TimeoutException ? "Timed out publishing" : "Failed to publish";
    String message =
        String.format(
            "%s event to Kafka topic=%s key=%s eventType=%s", prefix, topic, key, eventType);
    return new KafkaPublishException(topic, key, eventType, message, cause);
  }

  private static void addHeader(ProducerRecord<String, String> record, String name, String value) {
    record.headers().add(name, value.getBytes(StandardCharsets.UTF_8));
  }
}
