package com.festivalplatform.domain.webhooks.delivery;

import com.festivalplatform.domain.webhooks.WebhookDomainException;
import com.festivalplatform.domain.webhooks.event.Event;
import com.festivalplatform.domain.webhooks.event.EventPayloadCodec;
import com.festivalplatform.domain.webhooks.event.EventType;
import com.festivalplatform.domain.webhooks.signature.WebhookSignatures;
import com.festivalplatform.domain.webhooks.subscription.WebhookConfig;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record WebhookDelivery(
    UUID id,
    UUID webhookId,
    UUID tenantId,
    UUID eventId,
    EventType eventType,
    String targetUrl,
    String payload,
    String signature,
    DeliveryStatus status,
    int attemptCount,
    int maxAttempts,
    Instant nextRetryAt,
    Instant deliveredAt,
    String lastError,
    Instant createdAt,
    Instant updatedAt) {
  public static final int MAX_ERROR_CHARS = 2_000;

  public WebhookDelivery {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(webhookId, "webhookId must not be null");
    Objects.requireNonNull(tenantId, "tenantId must not be null");
    Objects.requireNonNull(eventId, "eventId must not be null");
    Objects.requireNonNull(eventType, "eventType must not be null");
    requireNonBlank(targetUrl, "targetUrl");
    requireNonBlank(payload, "payload");
    requireNonBlank(signature, "signature");
    Objects.requireNonNull(status, "status must not be null");
    if (maxAttempts < 1) {
      throw new WebhookDomainException("maxAttempts must be >= 1");
    }
    if (attemptCount < 0 || attemptCount > maxAttempts) {
      throw new WebhookDomainException("attemptCount must be between 0 and maxAttempts");
    }
    if (status == DeliveryStatus.DELIVERED && (nextRetryAt != null || deliveredAt == null)) {
      throw new WebhookDomainException(
          "Delivered delivery must have deliveredAt and no nextRetryAt");
    }
    if (status == DeliveryStatus.RETRYING && nextRetryAt == null) {
      throw new WebhookDomainException("Retrying delivery must have nextRetryAt");
    }
    lastError = DeliveryAttempt.truncate(lastError, MAX_ERROR_CHARS);
    Objects.requireNonNull(createdAt, "createdAt must not be null");
    Objects.requireNonNull(updatedAt, "updatedAt must not be null");
  }

  /**
   * Builds a pending delivery for {@code event}, snapshotting the config URL and signing the
   * encoded payload with the config secret at {@code now}.
   */
  public static WebhookDelivery create(
      UUID id,
      WebhookConfig config,
      Event event,
      EventPayloadCodec codec,
      String apiVersion,
      Instant now) {
    return create(id, config, event, codec, apiVersion, config.maxRetries(), now);
  }

  public static WebhookDelivery create(
      UUID id,
      WebhookConfig config,
      Event event,
      EventPayloadCodec codec,
      String apiVersion,
      int maxAttempts,
      Instant now) {
    Objects.requireNonNull(config, "config must not be null");
    Objects.requireNonNull(event, "event must not be null");
    Objects.requireNonNull(codec, "codec must not be null");
    Objects.requireNonNull(now, "now must not be null");
    byte[] body = codec.encode(event.toPayload(apiVersion));
    String signature = WebhookSignatures.generate(body, config.signingSecret(), now);
    return new WebhookDelivery(
        id,
        config.id(),
        event.tenantId(),
        event.id(),
        event.type(),
        config.targetUrl(),
        new String(body, StandardCharsets.UTF_8),
        signature,
        DeliveryStatus.PENDING,
        0,
        maxAttempts,
        null,
        null,
        null,
        now,
        now);
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }

  public boolean isDueForRetry(Instant now) {
    return status == DeliveryStatus.RETRYING && nextRetryAt != null && !nextRetryAt.isAfter(now);
  }

  /** Number the next HTTP attempt will carry in the attempt log. */
  public int nextAttemptNumber() {
    return Math.min(attemptCount + 1, maxAttempts);
  }

  public WebhookDelivery markDelivered(Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    if (status == DeliveryStatus.DELIVERED) {
      return this;
    }
    DeliveryStateMachine.validateTransition(status, DeliveryStatus.DELIVERED);
    return new WebhookDelivery(
        id,
        webhookId,
        tenantId,
        eventId,
        eventType,
        targetUrl,
        payload,
        signature,
        DeliveryStatus.DELIVERED,
        Math.min(attemptCount + 1, maxAttempts),
        maxAttempts,
        null,
        now,
        null,
        createdAt,
        now);
  }

  public RetryDecision scheduleRetry(String error, DeliveryBackoff backoff, Instant now) {
    Objects.requireNonNull(backoff, "backoff must not be null");
    Objects.requireNonNull(now, "now must not be null");
    int attempts = Math.min(attemptCount + 1, maxAttempts);
    if (attempts >= maxAttempts) {
      DeliveryStateMachine.validateTransition(status, DeliveryStatus.FAILED);
      WebhookDelivery failed =
          new WebhookDelivery(
              id,
              webhookId,
              tenantId,
              eventId,
              eventType,
              targetUrl,
              payload,
              signature,
              DeliveryStatus.FAILED,
              attempts,
              maxAttempts,
              null,
              null,
              error,
              createdAt,
              now);
      return new RetryDecision(failed, false);
    }
    DeliveryStateMachine.validateTransition(status, DeliveryStatus.RETRYING);
    Duration delay = backoff.delayForAttempt(attempts);
    WebhookDelivery retrying =
        new WebhookDelivery(
            id,
            webhookId,
            tenantId,
            eventId,
            eventType,
            targetUrl,
            payload,
            signature,
            DeliveryStatus.RETRYING,
            attempts,
            maxAttempts,
            now.plus(delay),
            null,
            error,
            createdAt,
            now);
    return new RetryDecision(retrying, true);
  }

  public WebhookDelivery markFailed(String error, Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    if (status == DeliveryStatus.FAILED) {
      return this;
    }
    DeliveryStateMachine.validateTransition(status, DeliveryStatus.FAILED);
    return new WebhookDelivery(
        id,
        webhookId,
        tenantId,
        eventId,
        eventType,
        targetUrl,
        payload,
        signature,
        DeliveryStatus.FAILED,
        attemptCount,
        maxAttempts,
        null,
        null,
        error,
        createdAt,
        now);
  }

  public WebhookDelivery resetForManualRetry(Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    if (!DeliveryStateMachine.canResetManually(status)) {
      throw new WebhookDomainException("Cannot retry delivery in status " + status);
    }
    return new WebhookDelivery(
        id,
        webhookId,
        tenantId,
        eventId,
        eventType,
        targetUrl,
        payload,
        signature,
        DeliveryStatus.PENDING,
        0,
        maxAttempts,
        null,
        null,
        null,
        createdAt,
        now);
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new WebhookDomainException(fieldName + " must not be blank");
    }
  }
}
