package com.festivalplatform.webhookservice.dispatch;

import com.festivalplatform.webhookservice.config.WebhookServiceProperties;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Recovers deliveries whose queue task was lost and prunes old terminal deliveries. */
@Component
@ConditionalOnProperty(
    prefix = "webhooks.sweeper",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class DeliverySweepScheduler {
  private static final Logger log = LoggerFactory.getLogger(DeliverySweepScheduler.class);

  private final WebhookDispatchService dispatchService;
  private final WebhookServiceProperties properties;
  private final Clock clock;

  public DeliverySweepScheduler(
      WebhookDispatchService dispatchService, WebhookServiceProperties properties, Clock clock) {
    this.dispatchService = dispatchService;
    this.properties = properties;
    this.clock = clock;
  }

  @Scheduled(
      fixedDelayString = "${webhooks.sweeper.pending-delay-ms:30000}",
      initialDelayString = "${webhooks.sweeper.pending-delay-ms:30000}")
  public void sweepPending() {
    WebhookServiceProperties.Sweeper sweeper = properties.getSweeper();
    try {
      dispatchService.processPendingDeliveries(
          clock.instant().minus(Duration.ofMillis(sweeper.getPendingGraceMs())),
          sweeper.getBatchSize());
    } catch (RuntimeException ex) {
      log.error("Pending delivery sweep failed error={}", ex.getMessage(), ex);
    }
  }

  @Scheduled(
      fixedDelayString = "${webhooks.sweeper.retry-delay-ms:15000}",
      initialDelayString = "${webhooks.sweeper.retry-delay-ms:15000}")
  public void sweepRetries() {
    try {
      dispatchService.processRetryDeliveries(properties.getSweeper().getBatchSize());
    } catch (RuntimeException ex) {
      log.error("Retry delivery sweep failed error={}", ex.getMessage(), ex);
    }
  }

  @Scheduled(cron = "${webhooks.retention.cleanup-cron:0 30 3 * * *}")
  public void cleanup() {
    try {
      dispatchService.cleanupOldDeliveries(properties.getRetention().getDays());
    } catch (RuntimeException ex) {
      log.error("Delivery cleanup failed error={}", ex.getMessage(), ex);
    }
  }
}
