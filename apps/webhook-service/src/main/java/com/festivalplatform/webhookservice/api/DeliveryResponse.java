package com.festivalplatform.webhookservice.api;

import com.festivalplatform.domain.webhooks.delivery.WebhookDelivery;
import java.time.Instant;
import java.util.UUID;

public record DeliveryResponse(
    UUID id,
    UUID webhookId,
    UUID tenantId,
    UUID eventId,
    String eventType,
    String url,
    String payload,
    String status,
    int attemptCount,
    int maxAttempts,
    Instant nextRetryAt,
    Instant deliveredAt,
    String lastError,
    Instant createdAt,
    Instant updatedAt) {

  public static DeliveryResponse from(WebhookDelivery delivery) {
    return new DeliveryResponse(
        delivery.id(),
        delivery.webhookId(),
        delivery.tenantId(),
        delivery.eventId(),
        delivery.eventType().wireName(),
        delivery.targetUrl(),
        delivery.payload(),
        delivery.status().name(),
        delivery.attemptCount(),
        delivery.maxAttempts(),
        delivery.nextRetryAt(),
        delivery.deliveredAt(),
        delivery.lastError(),
        delivery.createdAt(),
        delivery.updatedAt());
  }
}
