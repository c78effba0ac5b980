package com.festivalplatform.webhookservice.support;

import com.festivalplatform.domain.webhooks.delivery.DeliveryAttempt;
import com.festivalplatform.domain.webhooks.delivery.DeliveryStatus;
import com.festivalplatform.domain.webhooks.delivery.WebhookDelivery;
import com.festivalplatform.webhookservice.delivery.DeliveryStats;
import com.festivalplatform.webhookservice.delivery.WebhookDeliveryRepository;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

public class InMemoryWebhookDeliveryRepository implements WebhookDeliveryRepository {
  private final Map<UUID, WebhookDelivery> deliveries = new LinkedHashMap<>();
  private final List<DeliveryAttempt> attempts = new ArrayList<>();

  @Override
  public synchronized void insert(WebhookDelivery delivery) {
    deliveries.put(delivery.id(), delivery);
  }

  @Override
  public synchronized boolean updateIfUnchanged(
      WebhookDelivery next, DeliveryStatus expectedStatus, int expectedAttemptCount) {
    WebhookDelivery current = deliveries.get(next.id());
    if (current == null
        || current.status() != expectedStatus
        || current.attemptCount() != expectedAttemptCount) {
      return false;
    }
    deliveries.put(next.id(), next);
    return true;
  }

  @Override
  public synchronized Optional<WebhookDelivery> findById(UUID id) {
    return Optional.ofNullable(deliveries.get(id));
  }

  @Override
  public synchronized List<WebhookDelivery> findByWebhookId(UUID webhookId, int offset, int limit) {
    return deliveries.values().stream()
        .filter(delivery -> delivery.webhookId().equals(webhookId))
        .sorted(Comparator.comparing(WebhookDelivery::createdAt).reversed())
        .skip(offset)
        .limit(limit)
        .toList();
  }

  @Override
  public synchronized long countByWebhookId(UUID webhookId) {
    return deliveries.values().stream()
        .filter(delivery -> delivery.webhookId().equals(webhookId))
        .count();
  }

  @Override
  public synchronized List<UUID> findPendingIds(Instant createdBefore, int limit) {
    return deliveries.values().stream()
        .filter(delivery -> delivery.status() == DeliveryStatus.PENDING)
        .filter(delivery -> !delivery.createdAt().isAfter(createdBefore))
        .limit(limit)
        .map(WebhookDelivery::id)
        .toList();
  }

  @Override
  public synchronized List<UUID> findDueRetryIds(Instant now, int limit) {
    return deliveries.values().stream()
        .filter(delivery -> delivery.isDueForRetry(now))
        .limit(limit)
        .map(WebhookDelivery::id)
        .toList();
  }

  @Override
  public synchronized void appendAttempt(DeliveryAttempt attempt) {
    attempts.add(attempt);
  }

  @Override
  public synchronized List<DeliveryAttempt> findAttempts(UUID deliveryId) {
    return attempts.stream().filter(attempt -> attempt.deliveryId().equals(deliveryId)).toList();
  }

  @Override
  public synchronized int deleteTerminalCreatedBefore(Instant cutoff) {
    List<UUID> expired =
        deliveries.values().stream()
            .filter(WebhookDelivery::isTerminal)
            .filter(delivery -> delivery.createdAt().isBefore(cutoff))
            .map(WebhookDelivery::id)
            .toList();
    expired.forEach(deliveries::remove);
    attempts.removeIf(attempt -> expired.contains(attempt.deliveryId()));
    return expired.size();
  }

  @Override
  public synchronized DeliveryStats statsForWebhook(UUID webhookId, Instant since) {
    return stats(delivery -> delivery.webhookId().equals(webhookId), since);
  }

  @Override
  public synchronized DeliveryStats statsForTenant(UUID tenantId, Instant since) {
    return stats(delivery -> delivery.tenantId().equals(tenantId), since);
  }

  public synchronized List<WebhookDelivery> all() {
    return List.copyOf(deliveries.values());
  }

  private DeliveryStats stats(Predicate<WebhookDelivery> filter, Instant since) {
    List<WebhookDelivery> window =
        deliveries.values().stream()
            .filter(filter)
            .filter(delivery -> !delivery.createdAt().isBefore(since))
            .toList();
    return DeliveryStats.of(
        window.size(),
        count(window, DeliveryStatus.DELIVERED),
        count(window, DeliveryStatus.FAILED),
        count(window, DeliveryStatus.PENDING),
        count(window, DeliveryStatus.RETRYING),
        window.stream().mapToInt(WebhookDelivery::attemptCount).average().orElse(0.0d));
  }

  private static long count(List<WebhookDelivery> deliveries, DeliveryStatus status) {
    return deliveries.stream().filter(delivery -> delivery.status() == status).count();
  }
}
