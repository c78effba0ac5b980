package com.festivalplatform.webhookservice.delivery;

import com.festivalplatform.domain.webhooks.delivery.DeliveryAttempt;
import com.festivalplatform.domain.webhooks.delivery.WebhookDelivery;
import com.festivalplatform.webhookservice.registry.WebhookConfigRepository;
import com.festivalplatform.webhookservice.registry.WebhookNotFoundException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class DeliveryQueryService {
  static final int DEFAULT_PAGE_SIZE = 20;
  static final int MAX_PAGE_SIZE = 100;
  static final Duration DEFAULT_STATS_WINDOW = Duration.ofHours(24);

  private final WebhookDeliveryRepository deliveryRepository;
  private final WebhookConfigRepository webhookRepository;
  private final Clock clock;

  public DeliveryQueryService(
      WebhookDeliveryRepository deliveryRepository,
      WebhookConfigRepository webhookRepository,
      Clock clock) {
    this.deliveryRepository = deliveryRepository;
    this.webhookRepository = webhookRepository;
    this.clock = clock;
  }

  /** Pages are 1-based; sizes below 1 fall back to the default and larger ones are capped. */
  public DeliveryPage listDeliveries(UUID webhookId, int page, int size) {
    requireWebhook(webhookId);
    int safePage = Math.max(page, 1);
    int safeSize = size < 1 ? DEFAULT_PAGE_SIZE : Math.min(size, MAX_PAGE_SIZE);
    int offset = (safePage - 1) * safeSize;

    List<WebhookDelivery> deliveries =
        deliveryRepository.findByWebhookId(webhookId, offset, safeSize);
    long totalElements = deliveryRepository.countByWebhookId(webhookId);
    int totalPages = (int) Math.ceil((double) totalElements / safeSize);
    return new DeliveryPage(deliveries, safePage, safeSize, totalElements, totalPages);
  }

  public WebhookDelivery getDelivery(UUID deliveryId) {
    return deliveryRepository
        .findById(deliveryId)
        .orElseThrow(() -> new DeliveryNotFoundException(deliveryId));
  }

  public List<DeliveryAttempt> listAttempts(UUID deliveryId) {
    getDelivery(deliveryId);
    return deliveryRepository.findAttempts(deliveryId);
  }

  public DeliveryStats webhookStats(UUID webhookId, Instant since) {
    requireWebhook(webhookId);
    return deliveryRepository.statsForWebhook(webhookId, resolveSince(since));
  }

  public DeliveryStats tenantStats(UUID tenantId, Instant since) {
    return deliveryRepository.statsForTenant(tenantId, resolveSince(since));
  }

  private void requireWebhook(UUID webhookId) {
    if (webhookRepository.findById(webhookId).isEmpty()) {
      throw new WebhookNotFoundException(webhookId);
    }
  }

  /** Start of the statistics window; the last 24 hours when {@code since} is absent. */
  public Instant resolveSince(Instant since) {
    return since == null ? clock.instant().minus(DEFAULT_STATS_WINDOW) : since;
  }
}
