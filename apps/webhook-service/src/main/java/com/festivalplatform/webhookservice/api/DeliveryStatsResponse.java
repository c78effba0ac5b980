package com.festivalplatform.webhookservice.api;

import com.festivalplatform.webhookservice.delivery.DeliveryStats;
import java.time.Instant;

public record DeliveryStatsResponse(
    Instant since,
    long totalDeliveries,
    long successfulDeliveries,
    long failedDeliveries,
    long pendingDeliveries,
    long retryingDeliveries,
    double averageAttempts,
    double successRate) {

  public static DeliveryStatsResponse from(DeliveryStats stats, Instant since) {
    return new DeliveryStatsResponse(
        since,
        stats.totalDeliveries(),
        stats.successfulDeliveries(),
        stats.failedDeliveries(),
        stats.pendingDeliveries(),
        stats.retryingDeliveries(),
        stats.averageAttempts(),
        stats.successRate());
  }
}
