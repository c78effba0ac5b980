package com.festivalplatform.webhookservice.registry;

import com.festivalplatform.domain.webhooks.event.EventType;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

public record CreateWebhookCommand(
    UUID tenantId,
    String name,
    String description,
    String targetUrl,
    Set<EventType> eventTypes,
    Map<String, String> customHeaders,
    Integer maxRetries,
    Integer timeoutSeconds,
    String createdBy) {}
