package com.festivalplatform.webhookservice.api;

import com.festivalplatform.domain.webhooks.subscription.WebhookStatus;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Map;

public record UpdateWebhookRequest(
    @Size(min = 1, max = 255) String name,
    @Size(max = 2000) String description,
    @Size(min = 1, max = 2048) String url,
    @Size(min = 1) List<String> events,
    Map<String, String> headers,
    WebhookStatus status,
    @Min(1) @Max(10) Integer maxRetries,
    @Min(1) Integer timeoutSeconds) {}
