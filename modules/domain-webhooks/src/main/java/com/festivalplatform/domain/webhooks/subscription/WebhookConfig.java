package com.festivalplatform.domain.webhooks.subscription;

import com.festivalplatform.domain.webhooks.WebhookDomainException;
import com.festivalplatform.domain.webhooks.event.EventType;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

public record WebhookConfig(
    UUID id,
    UUID tenantId,
    String name,
    String description,
    String targetUrl,
    String signingSecret,
    Set<EventType> subscribedEventTypes,
    Map<String, String> customHeaders,
    WebhookStatus status,
    int maxRetries,
    int timeoutSeconds,
    int consecutiveFailureCount,
    Instant lastTriggeredAt,
    Instant lastSuccessAt,
    Instant lastFailureAt,
    String createdBy,
    Instant createdAt,
    Instant updatedAt) {
  public static final int FAILING_THRESHOLD = 10;
  public static final int MAX_RETRIES_LIMIT = 10;

  public WebhookConfig {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(tenantId, "tenantId must not be null");
    requireNonBlank(name, "name");
    requireNonBlank(targetUrl, "targetUrl");
    requireNonBlank(signingSecret, "signingSecret");
    if (subscribedEventTypes == null || subscribedEventTypes.isEmpty()) {
      throw new WebhookDomainException("subscribedEventTypes must not be empty");
    }
    subscribedEventTypes = Collections.unmodifiableSet(EnumSet.copyOf(subscribedEventTypes));
    customHeaders =
        customHeaders == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(customHeaders));
    Objects.requireNonNull(status, "status must not be null");
    if (maxRetries < 1 || maxRetries > MAX_RETRIES_LIMIT) {
      throw new WebhookDomainException("maxRetries must be between 1 and " + MAX_RETRIES_LIMIT);
    }
    if (timeoutSeconds < 1) {
      throw new WebhookDomainException("timeoutSeconds must be >= 1");
    }
    if (consecutiveFailureCount < 0) {
      throw new WebhookDomainException("consecutiveFailureCount must be >= 0");
    }
    if (consecutiveFailureCount >= FAILING_THRESHOLD && status == WebhookStatus.ACTIVE) {
      status = WebhookStatus.FAILING;
    }
    Objects.requireNonNull(createdAt, "createdAt must not be null");
    Objects.requireNonNull(updatedAt, "updatedAt must not be null");
  }

  public static WebhookConfig createNew(
      UUID id,
      UUID tenantId,
      String name,
      String description,
      String targetUrl,
      String signingSecret,
      Set<EventType> subscribedEventTypes,
      Map<String, String> customHeaders,
      int maxRetries,
      int timeoutSeconds,
      String createdBy,
      Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    return new WebhookConfig(
        id,
        tenantId,
        name,
        description,
        targetUrl,
        signingSecret,
        subscribedEventTypes,
        customHeaders,
        WebhookStatus.ACTIVE,
        maxRetries,
        timeoutSeconds,
        0,
        null,
        null,
        null,
        createdBy,
        now,
        now);
  }

  public boolean subscribesTo(EventType eventType) {
    return eventType != null && subscribedEventTypes.contains(eventType);
  }

  public boolean acceptsDeliveries() {
    return status.acceptsDeliveries();
  }

  public WebhookConfig withFailureRecorded(Instant now) {
    int failures = consecutiveFailureCount + 1;
    WebhookStatus nextStatus =
        failures >= FAILING_THRESHOLD && status == WebhookStatus.ACTIVE
            ? WebhookStatus.FAILING
            : status;
    return new WebhookConfig(
        id,
        tenantId,
        name,
        description,
        targetUrl,
        signingSecret,
        subscribedEventTypes,
        customHeaders,
        nextStatus,
        maxRetries,
        timeoutSeconds,
        failures,
        lastTriggeredAt,
        lastSuccessAt,
        now,
        createdBy,
        createdAt,
        now);
  }

  public WebhookConfig withSuccessRecorded(Instant now) {
    WebhookStatus nextStatus = status == WebhookStatus.FAILING ? WebhookStatus.ACTIVE : status;
    return new WebhookConfig(
        id,
        tenantId,
        name,
        description,
        targetUrl,
        signingSecret,
        subscribedEventTypes,
        customHeaders,
        nextStatus,
        maxRetries,
        timeoutSeconds,
        0,
        lastTriggeredAt,
        now,
        lastFailureAt,
        createdBy,
        createdAt,
        now);
  }

  public WebhookConfig withTriggered(Instant now) {
    return new WebhookConfig(
        id,
        tenantId,
        name,
        description,
        targetUrl,
        signingSecret,
        subscribedEventTypes,
        customHeaders,
        status,
        maxRetries,
        timeoutSeconds,
        consecutiveFailureCount,
        now,
        lastSuccessAt,
        lastFailureAt,
        createdBy,
        createdAt,
        now);
  }

  public WebhookConfig withSecret(String newSecret, Instant now) {
    return new WebhookConfig(
        id,
        tenantId,
        name,
        description,
        targetUrl,
        newSecret,
        subscribedEventTypes,
        customHeaders,
        status,
        maxRetries,
        timeoutSeconds,
        consecutiveFailureCount,
        lastTriggeredAt,
        lastSuccessAt,
        lastFailureAt,
        createdBy,
        createdAt,
        now);
  }

  /**
   * Applies a partial update; null arguments keep the current value. Setting ACTIVE explicitly
   * clears the failure counter so a FAILING webhook can be reactivated.
   */
  public WebhookConfig patch(
      String newName,
      String newDescription,
      String newTargetUrl,
      Set<EventType> newEventTypes,
      Map<String, String> newCustomHeaders,
      WebhookStatus newStatus,
      Integer newMaxRetries,
      Integer newTimeoutSeconds,
      Instant now) {
    return new WebhookConfig(
        id,
        tenantId,
        newName == null ? name : newName,
        newDescription == null ? description : newDescription,
        newTargetUrl == null ? targetUrl : newTargetUrl,
        signingSecret,
        newEventTypes == null ? subscribedEventTypes : newEventTypes,
        newCustomHeaders == null ? customHeaders : newCustomHeaders,
        newStatus == null ? status : newStatus,
        newMaxRetries == null ? maxRetries : newMaxRetries,
        newTimeoutSeconds == null ? timeoutSeconds : newTimeoutSeconds,
        newStatus == WebhookStatus.ACTIVE ? 0 : consecutiveFailureCount,
        lastTriggeredAt,
        lastSuccessAt,
        lastFailureAt,
        createdBy,
        createdAt,
        now);
  }

  @Override
  public String toString() {
    return "WebhookConfig[id="
        + id
        + ", tenantId="
        + tenantId
        + ", name="
        + name
        + ", targetUrl="
        + targetUrl
        + ", status="
        + status
        + ", consecutiveFailureCount="
        + consecutiveFailureCount
        + "]";
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new WebhookDomainException(fieldName + " must not be blank");
    }
  }
}
