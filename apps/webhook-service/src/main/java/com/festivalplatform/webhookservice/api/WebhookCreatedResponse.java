package com.festivalplatform.webhookservice.api;

import com.festivalplatform.domain.webhooks.subscription.WebhookConfig;

/** Only response that carries the signing secret besides a regeneration. */
public record WebhookCreatedResponse(WebhookResponse webhook, String secret) {
  public static WebhookCreatedResponse from(WebhookConfig config) {
    return new WebhookCreatedResponse(WebhookResponse.from(config), config.signingSecret());
  }
}
