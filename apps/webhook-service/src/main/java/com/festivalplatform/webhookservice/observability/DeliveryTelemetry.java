package com.festivalplatform.webhookservice.observability;

public interface DeliveryTelemetry {
  /** One HTTP attempt finished; {@code outcome} is success, failure or policy_rejected. */
  void onAttempt(String eventType, String outcome, long durationMillis);

  /** A delivery reached delivered, retry_scheduled or failed after an attempt. */
  void onDeliveryOutcome(String eventType, String outcome);

  void onDeliveriesCreated(String eventType, int count);
}
