package com.festivalplatform.infra.queue;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record DeliveryTask(UUID deliveryId, Reason reason, Instant enqueuedAt) {
  public enum Reason {
    DISPATCH,
    RETRY,
    PENDING_SWEEP,
    RETRY_SWEEP,
    MANUAL_RETRY
  }

  public DeliveryTask {
    Objects.requireNonNull(deliveryId, "deliveryId must not be null");
    Objects.requireNonNull(reason, "reason must not be null");
    Objects.requireNonNull(enqueuedAt, "enqueuedAt must not be null");
  }

  public static DeliveryTask of(UUID deliveryId, Reason reason, Instant now) {
    return new DeliveryTask(deliveryId, reason, now);
  }
}
