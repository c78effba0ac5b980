package com.festivalplatform.webhookservice.delivery;

import com.festivalplatform.domain.webhooks.delivery.DeliveryAttempt;
import com.festivalplatform.domain.webhooks.delivery.DeliveryStatus;
import com.festivalplatform.domain.webhooks.delivery.WebhookDelivery;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WebhookDeliveryRepository {
  void insert(WebhookDelivery delivery);

  /**
   * Persists {@code next} only if the stored row still has {@code expectedStatus} and {@code
   * expectedAttemptCount}. Returns false when another worker changed the row first.
   */
  boolean updateIfUnchanged(
      WebhookDelivery next, DeliveryStatus expectedStatus, int expectedAttemptCount);

  Optional<WebhookDelivery> findById(UUID id);

  List<WebhookDelivery> findByWebhookId(UUID webhookId, int offset, int limit);

  long countByWebhookId(UUID webhookId);

  List<UUID> findPendingIds(Instant createdBefore, int limit);

  List<UUID> findDueRetryIds(Instant now, int limit);

  void appendAttempt(DeliveryAttempt attempt);

  List<DeliveryAttempt> findAttempts(UUID deliveryId);

  /** Deletes DELIVERED and FAILED deliveries (and their attempts) created before {@code cutoff}. */
  int deleteTerminalCreatedBefore(Instant cutoff);

  DeliveryStats statsForWebhook(UUID webhookId, Instant since);

  DeliveryStats statsForTenant(UUID tenantId, Instant since);
}
