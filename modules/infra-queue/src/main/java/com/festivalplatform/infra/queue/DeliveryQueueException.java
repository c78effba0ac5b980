package com.festivalplatform.infra.queue;

import java.util.UUID;

public class DeliveryQueueException extends RuntimeException {
  private final UUID deliveryId;

  public DeliveryQueueException(UUID deliveryId, String message, Throwable cause) {
    super(message, cause);
    this.deliveryId = deliveryId;
  }

  public UUID getDeliveryId() {
    return deliveryId;
  }
}
