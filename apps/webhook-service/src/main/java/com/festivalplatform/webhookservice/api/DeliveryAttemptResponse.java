package com.festivalplatform.webhookservice.api;

import com.festivalplatform.domain.webhooks.delivery.DeliveryAttempt;
import java.time.Instant;
import java.util.UUID;

public record DeliveryAttemptResponse(
    UUID id,
    UUID deliveryId,
    int attemptNumber,
    Integer statusCode,
    String responseBody,
    long responseTimeMs,
    boolean success,
    String error,
    Instant attemptedAt) {

  public static DeliveryAttemptResponse from(DeliveryAttempt attempt) {
    return new DeliveryAttemptResponse(
        attempt.id(),
        attempt.deliveryId(),
        attempt.attemptNumber(),
        attempt.statusCode(),
        attempt.responseBody(),
        attempt.responseTimeMillis(),
        attempt.success(),
        attempt.error(),
        attempt.attemptedAt());
  }
}
