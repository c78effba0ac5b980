package com.festivalplatform.webhookservice.registry;

import com.festivalplatform.domain.webhooks.event.EventType;
import com.festivalplatform.domain.webhooks.subscription.WebhookStatus;
import java.util.Map;
import java.util.Set;

/** Partial update; null fields are left unchanged. */
public record UpdateWebhookCommand(
    String name,
    String description,
    String targetUrl,
    Set<EventType> eventTypes,
    Map<String, String> customHeaders,
    WebhookStatus status,
    Integer maxRetries,
    Integer timeoutSeconds) {}
