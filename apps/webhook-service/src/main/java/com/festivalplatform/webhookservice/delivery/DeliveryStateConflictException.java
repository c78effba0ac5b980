package com.festivalplatform.webhookservice.delivery;

import com.festivalplatform.domain.webhooks.delivery.DeliveryStatus;
import java.util.UUID;

public class DeliveryStateConflictException extends RuntimeException {
  private final UUID deliveryId;
  private final DeliveryStatus status;

  public DeliveryStateConflictException(UUID deliveryId, DeliveryStatus status, String message) {
    super(message);
    this.deliveryId = deliveryId;
    this.status = status;
  }

  public UUID deliveryId() {
    return deliveryId;
  }

  public DeliveryStatus status() {
    return status;
  }
}
