package com.dollarstore.infra.kafka.observability;

public interface KafkaTelemetry {
  void onPublishSuccess(String topic, String key, String eventType, long durationNanos);

  void onPublishFailure(String topic, String key, String eventType, Throwable error);
}
