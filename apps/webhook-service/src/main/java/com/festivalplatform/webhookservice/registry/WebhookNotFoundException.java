package com.festivalplatform.webhookservice.registry;

import java.util.UUID;

public class WebhookNotFoundException extends RuntimeException {
  public WebhookNotFoundException(UUID webhookId) {
    super("Webhook not found: " + webhookId);
  }
}
