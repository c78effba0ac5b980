package com.festivalplatform.domain.webhooks.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

public class EventPayloadCodec {
  private static final TypeReference<Map<String, Object>> DATA_TYPE = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public EventPayloadCodec() {
    this(createObjectMapper());
  }

  public EventPayloadCodec(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
  }

  public static ObjectMapper createObjectMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
  }

  public byte[] encode(EventPayload payload) {
    try {
      return objectMapper.writeValueAsString(payload).getBytes(StandardCharsets.UTF_8);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to encode event payload id=" + payload.id(), ex);
    }
  }

  public EventPayload decode(String json) {
    try {
      return objectMapper.readValue(json, EventPayload.class);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to decode event payload", ex);
    }
  }

  /** Flattens a typed payload record into the data map carried by an {@link Event}. */
  public Map<String, Object> toData(EventType type, Object typedPayload) {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(typedPayload, "typedPayload must not be null");
    if (!type.payloadType().isInstance(typedPayload)) {
      throw new IllegalArgumentException(
          "Payload "
              + typedPayload.getClass().getSimpleName()
              + " does not match event type "
              + type.wireName());
    }
    return objectMapper.convertValue(typedPayload, DATA_TYPE);
  }

  public Event newEvent(EventType type, UUID tenantId, Object typedPayload, Instant now) {
    return Event.of(type, tenantId, toData(type, typedPayload), now);
  }
}
