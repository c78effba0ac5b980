package com.festivalplatform.webhookservice.registry;

import com.festivalplatform.domain.webhooks.event.EventType;
import com.festivalplatform.domain.webhooks.subscription.WebhookConfig;
import com.festivalplatform.domain.webhooks.subscription.WebhookStatus;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WebhookConfigRepository {
  void insert(WebhookConfig config);

  /**
   * Writes the editable settings. Status is written only when {@code requestedStatus} is non-null,
   * and an explicit ACTIVE clears the failure counter; otherwise health is left to the atomic
   * operations below.
   */
  void updateSettings(WebhookConfig config, WebhookStatus requestedStatus);

  void updateSecret(UUID id, String signingSecret, Instant updatedAt);

  Optional<WebhookConfig> findById(UUID id);

  List<WebhookConfig> findByTenantId(UUID tenantId);

  /** ACTIVE webhooks of {@code tenantId} subscribed to {@code eventType}. */
  List<WebhookConfig> findDispatchable(UUID tenantId, EventType eventType);

  boolean deleteById(UUID id);

  void markTriggered(UUID id, Instant triggeredAt);

  void incrementFailure(UUID id, Instant failedAt);

  void resetFailureCount(UUID id, Instant succeededAt);
}
