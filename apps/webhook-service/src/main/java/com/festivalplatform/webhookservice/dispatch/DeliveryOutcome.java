package com.festivalplatform.webhookservice.dispatch;

public enum DeliveryOutcome {
  DELIVERED,
  RETRY_SCHEDULED,
  FAILED,
  /** Nothing was sent: the delivery was missing, terminal, not yet due or changed concurrently. */
  SKIPPED
}
