package com.festivalplatform.webhookservice.api;

import com.festivalplatform.domain.webhooks.event.EventType;
import com.festivalplatform.domain.webhooks.subscription.WebhookConfig;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record WebhookResponse(
    UUID id,
    UUID tenantId,
    String name,
    String description,
    String url,
    List<String> events,
    Map<String, String> headers,
    String status,
    int maxRetries,
    int timeoutSeconds,
    int consecutiveFailureCount,
    Instant lastTriggeredAt,
    Instant lastSuccessAt,
    Instant lastFailureAt,
    String createdBy,
    Instant createdAt,
    Instant updatedAt) {

  public static WebhookResponse from(WebhookConfig config) {
    return new WebhookResponse(
        config.id(),
        config.tenantId(),
        config.name(),
        config.description(),
        config.targetUrl(),
        config.subscribedEventTypes().stream().map(EventType::wireName).toList(),
        config.customHeaders(),
        config.status().name(),
        config.maxRetries(),
        config.timeoutSeconds(),
        config.consecutiveFailureCount(),
        config.lastTriggeredAt(),
        config.lastSuccessAt(),
        config.lastFailureAt(),
        config.createdBy(),
        config.createdAt(),
        config.updatedAt());
  }
}
