package com.dollarstore.infra.kafka.serde;

import com.dollarstore.infra.kafka.contract.EventEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class EventEnvelopeJsonCodec {
  private final ObjectMapper objectMapper;

  public EventEnvelopeJsonCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String encode(EventEnvelope<?> envelope) {
    try {
      return objectMapper.writeValueAsString(envelope);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException(
          "Failed to encode event envelope eventType=" + envelope.eventType(), ex);
    }
  }

  public <T> EventEnvelope<T> decode(String json, Class<T> payloadType) {
    try {
      JavaType envelopeType =
          objectMapper.getTypeFactory().constructParametricType(EventEnvelope.class, payloadType);
      return objectMapper.readValue(json, envelopeType);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to decode event envelope", ex);
    }
  }

  public String encodePayload(Object payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException(
          "Failed to encode event payload type=" + payload.getClass().getSimpleName(), ex);
    }
  }

  public JsonNode readPayload(String payloadJson) {
    if (payloadJson == null || payloadJson.isBlank()) {
      return objectMapper.createObjectNode();
    }
    try {
      return objectMapper.readTree(payloadJson);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to parse event payload", ex);
    }
  }
}
