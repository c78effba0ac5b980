package com.festivalplatform.domain.webhooks.delivery;

import java.util.Objects;

public record RetryDecision(WebhookDelivery delivery, boolean willRetry) {
  public RetryDecision {
    Objects.requireNonNull(delivery, "delivery must not be null");
  }

  public boolean exhausted() {
    return !willRetry;
  }
}
