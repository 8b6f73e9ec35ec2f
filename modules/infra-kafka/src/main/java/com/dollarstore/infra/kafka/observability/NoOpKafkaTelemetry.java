package com.dollarstore.infra.kafka.observability;

public class NoOpKafkaTelemetry implements KafkaTelemetry {
  @Override
  public void onPublishSuccess(String topic, String key, String eventType, long durationNanos) {}

  @Override
  public void onPublishFailure(String topic, String key, String eventType, Throwable error) {}
}
