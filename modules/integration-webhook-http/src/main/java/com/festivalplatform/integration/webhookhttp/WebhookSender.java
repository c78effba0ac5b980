package com.festivalplatform.integration.webhookhttp;

import com.festivalplatform.domain.webhooks.delivery.WebhookDelivery;
import java.time.Duration;
import java.util.Map;

public interface WebhookSender {
  /**
   * Performs one HTTP attempt for {@code delivery}. Never throws for delivery failures; the
   * outcome is described by the returned {@link SendResult}.
   */
  SendResult send(WebhookDelivery delivery, Map<String, String> customHeaders, Duration timeout);
}
