package com.festivalplatform.domain.webhooks.subscription;

public enum WebhookStatus {
  ACTIVE,
  INACTIVE,
  FAILING,
  DISABLED;

  /** Only ACTIVE webhooks receive deliveries; FAILING ones wait for an admin to reactivate them. */
  public boolean acceptsDeliveries() {
    return this == ACTIVE;
  }
}
