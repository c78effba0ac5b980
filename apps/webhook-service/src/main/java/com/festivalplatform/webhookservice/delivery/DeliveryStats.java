package com.festivalplatform.webhookservice.delivery;

public record DeliveryStats(
    long totalDeliveries,
    long successfulDeliveries,
    long failedDeliveries,
    long pendingDeliveries,
    long retryingDeliveries,
    double averageAttempts,
    double successRate) {

  public static DeliveryStats of(
      long total, long delivered, long failed, long pending, long retrying, double avgAttempts) {
    double successRate = total == 0L ? 0.0d : (double) delivered / (double) total * 100.0d;
    return new DeliveryStats(total, delivered, failed, pending, retrying, avgAttempts, successRate);
  }
}
