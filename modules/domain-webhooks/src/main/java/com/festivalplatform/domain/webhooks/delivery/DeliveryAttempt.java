package com.festivalplatform.domain.webhooks.delivery;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record DeliveryAttempt(
    UUID id,
    UUID deliveryId,
    int attemptNumber,
    Integer statusCode,
    String responseBody,
    long responseTimeMillis,
    boolean success,
    String error,
    Instant attemptedAt) {
  public static final int MAX_RESPONSE_BODY_CHARS = 65_536;
  public static final int MAX_ERROR_CHARS = 2_000;

  public DeliveryAttempt {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(deliveryId, "deliveryId must not be null");
    if (attemptNumber < 1) {
      throw new IllegalArgumentException("attemptNumber must be >= 1");
    }
    responseBody = truncate(responseBody, MAX_RESPONSE_BODY_CHARS);
    responseTimeMillis = Math.max(0L, responseTimeMillis);
    error = truncate(error, MAX_ERROR_CHARS);
    Objects.requireNonNull(attemptedAt, "attemptedAt must not be null");
  }

  static String truncate(String value, int maxChars) {
    if (value == null || value.length() <= maxChars) {
      return value;
    }
    return value.substring(0, maxChars);
  }
}
