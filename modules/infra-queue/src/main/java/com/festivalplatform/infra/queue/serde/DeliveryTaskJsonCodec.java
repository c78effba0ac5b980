package com.festivalplatform.infra.queue.serde;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.festivalplatform.infra.queue.DeliveryTask;
import java.util.Objects;

public class DeliveryTaskJsonCodec {
  private final ObjectMapper objectMapper;

  public DeliveryTaskJsonCodec() {
    this(createObjectMapper());
  }

  public DeliveryTaskJsonCodec(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
  }

  public static ObjectMapper createObjectMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  public String encode(DeliveryTask task) {
    try {
      return objectMapper.writeValueAsString(task);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException(
          "Failed to encode delivery task deliveryId=" + task.deliveryId(), ex);
    }
  }

  public DeliveryTask decode(String json) {
    if (json == null || json.isBlank()) {
      throw new IllegalArgumentException("Delivery task payload must not be blank");
    }
    try {
      return objectMapper.readValue(json, DeliveryTask.class);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Failed to decode delivery task payload", ex);
    }
  }
}
