package com.festivalplatform.domain.webhooks.event;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

public record Event(
    UUID id, EventType type, UUID tenantId, Instant timestamp, Map<String, Object> data) {
  public static final String DEFAULT_API_VERSION = "2024-01-01";

  public Event {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(tenantId, "tenantId must not be null");
    Objects.requireNonNull(timestamp, "timestamp must not be null");
    data =
        data == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }

  public static Event of(EventType type, UUID tenantId, Map<String, Object> data, Instant now) {
    return new Event(UUID.randomUUID(), type, tenantId, now, data);
  }

  public EventPayload toPayload(String apiVersion) {
    String version = apiVersion == null || apiVersion.isBlank() ? DEFAULT_API_VERSION : apiVersion;
    return new EventPayload(
        id.toString(),
        type.wireName(),
        tenantId.toString(),
        DateTimeFormatter.ISO_INSTANT.format(timestamp.truncatedTo(ChronoUnit.SECONDS)),
        version,
        data);
  }
}
