package com.festivalplatform.integration.webhookhttp;

import java.time.Duration;

public record WebhookSenderConfig(
    String userAgent,
    int maxResponseBodyBytes,
    Duration connectTimeout,
    Duration defaultTimeout) {
  public static final String DEFAULT_USER_AGENT = "FestivalPlatform-Webhook/1.0";
  public static final int DEFAULT_MAX_RESPONSE_BODY_BYTES = 64 * 1024;

  public WebhookSenderConfig {
    if (userAgent == null || userAgent.isBlank()) {
      throw new IllegalArgumentException("userAgent is required");
    }
    if (maxResponseBodyBytes < 1) {
      throw new IllegalArgumentException("maxResponseBodyBytes must be > 0");
    }
    if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
      throw new IllegalArgumentException("connectTimeout must be > 0");
    }
    if (defaultTimeout == null || defaultTimeout.isNegative() || defaultTimeout.isZero()) {
      throw new IllegalArgumentException("defaultTimeout must be > 0");
    }
  }

  public static WebhookSenderConfig defaults() {
    return new WebhookSenderConfig(
        DEFAULT_USER_AGENT,
        DEFAULT_MAX_RESPONSE_BODY_BYTES,
        Duration.ofSeconds(10),
        Duration.ofSeconds(30));
  }
}
