package com.festivalplatform.webhookservice.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Map;

public record CreateWebhookRequest(
    @NotBlank @Size(max = 255) String name,
    @Size(max = 2000) String description,
    @NotBlank @Size(max = 2048) String url,
    @NotEmpty List<@NotBlank String> events,
    Map<String, String> headers,
    @Min(1) @Max(10) Integer maxRetries,
    @Min(1) Integer timeoutSeconds,
    @Size(max = 255) String createdBy) {}
