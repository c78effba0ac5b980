package com.festivalplatform.webhookservice.dispatch;

import com.festivalplatform.domain.webhooks.delivery.DeliveryAttempt;
import com.festivalplatform.domain.webhooks.delivery.DeliveryBackoff;
import com.festivalplatform.domain.webhooks.delivery.DeliveryStatus;
import com.festivalplatform.domain.webhooks.delivery.RetryDecision;
import com.festivalplatform.domain.webhooks.delivery.WebhookDelivery;
import com.festivalplatform.domain.webhooks.event.Event;
import com.festivalplatform.domain.webhooks.event.EventPayloadCodec;
import com.festivalplatform.domain.webhooks.event.EventType;
import com.festivalplatform.domain.webhooks.subscription.WebhookConfig;
import com.festivalplatform.infra.queue.DeliveryTask;
import com.festivalplatform.infra.queue.DeliveryTaskHandler;
import com.festivalplatform.infra.queue.DeliveryTaskQueue;
import com.festivalplatform.integration.webhookhttp.SendResult;
import com.festivalplatform.integration.webhookhttp.WebhookSender;
import com.festivalplatform.webhookservice.config.WebhookServiceProperties;
import com.festivalplatform.webhookservice.delivery.DeliveryNotFoundException;
import com.festivalplatform.webhookservice.delivery.DeliveryStateConflictException;
import com.festivalplatform.webhookservice.delivery.WebhookDeliveryRepository;
import com.festivalplatform.webhookservice.observability.DeliveryTelemetry;
import com.festivalplatform.webhookservice.registry.WebhookConfigRepository;
import com.festivalplatform.webhookservice.registry.WebhookNotFoundException;
import com.festivalplatform.webhookservice.registry.WebhookRegistryService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class WebhookDispatchService implements DeliveryTaskHandler {
  private static final Logger log = LoggerFactory.getLogger(WebhookDispatchService.class);

  static final Map<String, Object> DEFAULT_TEST_DATA = defaultTestData();

  private final WebhookRegistryService registryService;
  private final WebhookConfigRepository webhookRepository;
  private final WebhookDeliveryRepository deliveryRepository;
  private final WebhookSender sender;
  private final DeliveryTaskQueue taskQueue;
  private final DeliveryBackoff backoff;
  private final EventPayloadCodec payloadCodec;
  private final DeliveryTelemetry telemetry;
  private final WebhookServiceProperties properties;
  private final Clock clock;

  public WebhookDispatchService(
      WebhookRegistryService registryService,
      WebhookConfigRepository webhookRepository,
      WebhookDeliveryRepository deliveryRepository,
      WebhookSender sender,
      DeliveryTaskQueue taskQueue,
      DeliveryBackoff backoff,
      EventPayloadCodec payloadCodec,
      DeliveryTelemetry telemetry,
      WebhookServiceProperties properties,
      Clock clock) {
    this.registryService = registryService;
    this.webhookRepository = webhookRepository;
    this.deliveryRepository = deliveryRepository;
    this.sender = sender;
    this.taskQueue = taskQueue;
    this.backoff = backoff;
    this.payloadCodec = payloadCodec;
    this.telemetry = telemetry;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Creates and enqueues one signed delivery per subscribed webhook. Failures are isolated per
   * subscriber and never reach the caller.
   *
   * @return the number of deliveries persisted
   */
  public int dispatchEvent(Event event) {
    List<WebhookConfig> subscribers;
    try {
      subscribers = registryService.resolveActiveSubscribers(event.tenantId(), event.type());
    } catch (RuntimeException ex) {
      log.error(
          "Webhook subscriber lookup failed event_id={} event_type={} tenant_id={} error={}",
          event.id(),
          event.type(),
          event.tenantId(),
          ex.getMessage(),
          ex);
      return 0;
    }

    if (subscribers.isEmpty()) {
      log.debug(
          "No webhooks subscribed event_type={} tenant_id={}", event.type(), event.tenantId());
      return 0;
    }

    log.info(
        "Dispatching event event_id={} event_type={} webhook_count={}",
        event.id(),
        event.type(),
        subscribers.size());

    int created = 0;
    for (WebhookConfig config : subscribers) {
      try {
        createAndEnqueue(config, event);
        created++;
      } catch (RuntimeException ex) {
        log.error(
            "Webhook delivery creation failed webhook_id={} event_id={} error={}",
            config.id(),
            event.id(),
            ex.getMessage(),
            ex);
      }
    }
    telemetry.onDeliveriesCreated(event.type().wireName(), created);
    return created;
  }

  @Override
  public void handle(DeliveryTask task) {
    processDelivery(task.deliveryId());
  }

  /** Performs one attempt for the delivery and records the outcome. Never throws. */
  public DeliveryOutcome processDelivery(UUID deliveryId) {
    WebhookDelivery delivery;
    WebhookConfig config;
    try {
      delivery = deliveryRepository.findById(deliveryId).orElse(null);
      if (delivery == null) {
        log.warn("Webhook delivery not found delivery_id={}", deliveryId);
        return DeliveryOutcome.SKIPPED;
      }
      if (delivery.isTerminal()) {
        log.info(
            "Webhook delivery already terminal delivery_id={} status={}",
            deliveryId,
            delivery.status());
        return DeliveryOutcome.SKIPPED;
      }
      if (delivery.status() == DeliveryStatus.RETRYING
          && !delivery.isDueForRetry(clock.instant())) {
        log.debug(
            "Webhook delivery not yet due delivery_id={} next_retry_at={}",
            deliveryId,
            delivery.nextRetryAt());
        return DeliveryOutcome.SKIPPED;
      }
      config = webhookRepository.findById(delivery.webhookId()).orElse(null);
    } catch (RuntimeException ex) {
      log.error(
          "Webhook delivery load failed delivery_id={} error={}", deliveryId, ex.getMessage(), ex);
      return DeliveryOutcome.SKIPPED;
    }

    if (config == null || !config.acceptsDeliveries()) {
      String reason =
          config == null ? "webhook not found" : "webhook is not active: " + config.status();
      WebhookDelivery failed = delivery.markFailed(reason, clock.instant());
      if (!persist(delivery, failed)) {
        return DeliveryOutcome.SKIPPED;
      }
      log.warn(
          "Webhook delivery abandoned delivery_id={} webhook_id={} reason={}",
          deliveryId,
          delivery.webhookId(),
          reason);
      telemetry.onDeliveryOutcome(delivery.eventType().wireName(), "failed");
      return DeliveryOutcome.FAILED;
    }

    int attemptNumber = delivery.nextAttemptNumber();
    SendResult result =
        sender.send(
            delivery, config.customHeaders(), Duration.ofSeconds(config.timeoutSeconds()));
    Instant finishedAt = clock.instant();
    recordAttempt(delivery, attemptNumber, result, finishedAt);
    telemetry.onAttempt(
        delivery.eventType().wireName(), attemptOutcome(result), result.responseTimeMillis());

    if (result.success()) {
      return onSuccess(delivery, config, result, finishedAt);
    }
    if (result.policyRejected()) {
      return onPolicyRejected(delivery, config, result, finishedAt);
    }
    return onFailure(delivery, config, result, finishedAt);
  }

  /**
   * Sends one synchronous test request. Nothing is persisted and webhook health is not touched.
   */
  public SendResult testWebhook(UUID webhookId, EventType eventType, Map<String, Object> data) {
    WebhookConfig config =
        webhookRepository
            .findById(webhookId)
            .orElseThrow(() -> new WebhookNotFoundException(webhookId));
    EventType type =
        eventType == null ? config.subscribedEventTypes().iterator().next() : eventType;
    Map<String, Object> payload = data == null || data.isEmpty() ? DEFAULT_TEST_DATA : data;
    Instant now = clock.instant();
    Event event = Event.of(type, config.tenantId(), payload, now);
    WebhookDelivery delivery =
        WebhookDelivery.create(
            UUID.randomUUID(), config, event, payloadCodec, properties.getApiVersion(), 1, now);

    SendResult result =
        sender.send(
            delivery, config.customHeaders(), Duration.ofSeconds(config.timeoutSeconds()));
    log.info(
        "Webhook test completed webhook_id={} event_type={} success={} status_code={}",
        webhookId,
        type,
        result.success(),
        result.statusCode());
    return result;
  }

  /** Re-enqueues PENDING deliveries created before {@code createdBefore}. */
  public int processPendingDeliveries(Instant createdBefore, int limit) {
    List<UUID> ids = deliveryRepository.findPendingIds(createdBefore, Math.max(1, limit));
    return enqueueAll(ids, DeliveryTask.Reason.PENDING_SWEEP);
  }

  public int processRetryDeliveries(int limit) {
    List<UUID> ids = deliveryRepository.findDueRetryIds(clock.instant(), Math.max(1, limit));
    return enqueueAll(ids, DeliveryTask.Reason.RETRY_SWEEP);
  }

  public int cleanupOldDeliveries(int retentionDays) {
    if (retentionDays < 1) {
      throw new IllegalArgumentException("retentionDays must be >= 1");
    }
    Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
    int deleted = deliveryRepository.deleteTerminalCreatedBefore(cutoff);
    if (deleted > 0) {
      log.info(
          "Webhook deliveries cleaned up deleted={} retention_days={}", deleted, retentionDays);
    }
    return deleted;
  }

  /**
   * Resets a non-delivered delivery to PENDING with zero attempts and enqueues it immediately.
   *
   * @throws DeliveryStateConflictException if the delivery already succeeded
   */
  public WebhookDelivery retryDelivery(UUID deliveryId) {
    WebhookDelivery current =
        deliveryRepository
            .findById(deliveryId)
            .orElseThrow(() -> new DeliveryNotFoundException(deliveryId));
    if (current.status() == DeliveryStatus.DELIVERED) {
      throw new DeliveryStateConflictException(
          deliveryId, current.status(), "Delivery was already successful: " + deliveryId);
    }
    Instant now = clock.instant();
    WebhookDelivery reset = current.resetForManualRetry(now);
    if (!deliveryRepository.updateIfUnchanged(
        reset, current.status(), current.attemptCount())) {
      throw new DeliveryStateConflictException(
          deliveryId, current.status(), "Delivery changed concurrently: " + deliveryId);
    }
    log.info("Webhook delivery manually retried delivery_id={}", deliveryId);
    enqueueQuietly(DeliveryTask.of(deliveryId, DeliveryTask.Reason.MANUAL_RETRY, now));
    return reset;
  }

  private void createAndEnqueue(WebhookConfig config, Event event) {
    Instant now = clock.instant();
    WebhookDelivery delivery =
        WebhookDelivery.create(
            UUID.randomUUID(), config, event, payloadCodec, properties.getApiVersion(), now);
    deliveryRepository.insert(delivery);
    try {
      registryService.markTriggered(config.id());
    } catch (RuntimeException ex) {
      log.warn(
          "Webhook last_triggered_at update failed webhook_id={} error={}",
          config.id(),
          ex.getMessage());
    }
    log.info(
        "Webhook delivery created delivery_id={} webhook_id={} event_id={} event_type={}",
        delivery.id(),
        config.id(),
        event.id(),
        event.type());
    enqueueQuietly(DeliveryTask.of(delivery.id(), DeliveryTask.Reason.DISPATCH, now));
  }

  private DeliveryOutcome onSuccess(
      WebhookDelivery delivery, WebhookConfig config, SendResult result, Instant finishedAt) {
    if (!persist(delivery, delivery.markDelivered(finishedAt))) {
      return DeliveryOutcome.SKIPPED;
    }
    resetHealth(config.id());
    log.info(
        "Webhook delivered delivery_id={} webhook_id={} status_code={} response_time_ms={}",
        delivery.id(),
        config.id(),
        result.statusCode(),
        result.responseTimeMillis());
    telemetry.onDeliveryOutcome(delivery.eventType().wireName(), "delivered");
    return DeliveryOutcome.DELIVERED;
  }

  private DeliveryOutcome onPolicyRejected(
      WebhookDelivery delivery, WebhookConfig config, SendResult result, Instant finishedAt) {
    if (!persist(delivery, delivery.markFailed(result.error(), finishedAt))) {
      return DeliveryOutcome.SKIPPED;
    }
    recordHealthFailure(config.id());
    log.warn(
        "Webhook delivery policy_rejected delivery_id={} webhook_id={} error={}",
        delivery.id(),
        config.id(),
        result.error());
    telemetry.onDeliveryOutcome(delivery.eventType().wireName(), "failed");
    return DeliveryOutcome.FAILED;
  }

  private DeliveryOutcome onFailure(
      WebhookDelivery delivery, WebhookConfig config, SendResult result, Instant finishedAt) {
    String error = result.error() == null ? "unknown error" : result.error();
    RetryDecision decision = delivery.scheduleRetry(error, backoff, finishedAt);
    WebhookDelivery next = decision.delivery();
    if (!persist(delivery, next)) {
      return DeliveryOutcome.SKIPPED;
    }

    if (decision.willRetry()) {
      log.info(
          "Webhook delivery retry scheduled delivery_id={} webhook_id={} attempt={} next_retry_at={} error={}",
          delivery.id(),
          config.id(),
          next.attemptCount(),
          next.nextRetryAt(),
          error);
      try {
        taskQueue.enqueueAt(
            DeliveryTask.of(delivery.id(), DeliveryTask.Reason.RETRY, finishedAt),
            next.nextRetryAt());
      } catch (RuntimeException ex) {
        log.warn(
            "Webhook retry enqueue failed, leaving to retry sweep delivery_id={} error={}",
            delivery.id(),
            ex.getMessage());
      }
      telemetry.onDeliveryOutcome(delivery.eventType().wireName(), "retry_scheduled");
      return DeliveryOutcome.RETRY_SCHEDULED;
    }

    recordHealthFailure(config.id());
    log.warn(
        "Webhook delivery failed delivery_id={} webhook_id={} attempts={} error={}",
        delivery.id(),
        config.id(),
        next.attemptCount(),
        error);
    telemetry.onDeliveryOutcome(delivery.eventType().wireName(), "failed");
    return DeliveryOutcome.FAILED;
  }

  private void recordAttempt(
      WebhookDelivery delivery, int attemptNumber, SendResult result, Instant attemptedAt) {
    DeliveryAttempt attempt =
        new DeliveryAttempt(
            UUID.randomUUID(),
            delivery.id(),
            attemptNumber,
            result.statusCode(),
            result.responseBody(),
            result.responseTimeMillis(),
            result.success(),
            result.error(),
            attemptedAt);
    try {
      deliveryRepository.appendAttempt(attempt);
    } catch (RuntimeException ex) {
      log.error(
          "Webhook attempt record failed delivery_id={} attempt={} error={}",
          delivery.id(),
          attemptNumber,
          ex.getMessage(),
          ex);
    }
  }

  private boolean persist(WebhookDelivery current, WebhookDelivery next) {
    try {
      if (deliveryRepository.updateIfUnchanged(next, current.status(), current.attemptCount())) {
        return true;
      }
      log.warn(
          "Webhook delivery changed concurrently, discarding outcome delivery_id={} status={}",
          current.id(),
          next.status());
      return false;
    } catch (RuntimeException ex) {
      log.error(
          "Webhook delivery update failed delivery_id={} status={} error={}",
          current.id(),
          next.status(),
          ex.getMessage(),
          ex);
      return false;
    }
  }

  private void resetHealth(UUID webhookId) {
    try {
      registryService.resetFailureCount(webhookId);
    } catch (RuntimeException ex) {
      log.error(
          "Webhook health reset failed webhook_id={} error={}", webhookId, ex.getMessage(), ex);
    }
  }

  private void recordHealthFailure(UUID webhookId) {
    try {
      registryService.incrementFailure(webhookId);
    } catch (RuntimeException ex) {
      log.error(
          "Webhook health increment failed webhook_id={} error={}",
          webhookId,
          ex.getMessage(),
          ex);
    }
  }

  private int enqueueAll(List<UUID> deliveryIds, DeliveryTask.Reason reason) {
    Instant now = clock.instant();
    int enqueued = 0;
    for (UUID deliveryId : deliveryIds) {
      if (enqueueQuietly(DeliveryTask.of(deliveryId, reason, now))) {
        enqueued++;
      }
    }
    if (enqueued > 0) {
      log.info("Webhook sweep enqueued reason={} count={}", reason, enqueued);
    }
    return enqueued;
  }

  private boolean enqueueQuietly(DeliveryTask task) {
    try {
      taskQueue.enqueue(task);
      return true;
    } catch (RuntimeException ex) {
      log.error(
          "Webhook delivery enqueue failed, leaving to sweep delivery_id={} reason={} error={}",
          task.deliveryId(),
          task.reason(),
          ex.getMessage());
      return false;
    }
  }

  private static String attemptOutcome(SendResult result) {
    if (result.success()) {
      return "success";
    }
    return result.policyRejected() ? "policy_rejected" : "failure";
  }

  private static Map<String, Object> defaultTestData() {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("test", true);
    data.put("message", "This is a test webhook event");
    return Collections.unmodifiableMap(data);
  }
}
