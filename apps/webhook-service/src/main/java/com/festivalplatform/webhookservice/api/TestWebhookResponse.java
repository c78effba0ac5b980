package com.festivalplatform.webhookservice.api;

import com.festivalplatform.integration.webhookhttp.SendResult;

public record TestWebhookResponse(
    boolean success, Integer statusCode, long responseTimeMs, String responseBody, String error) {

  public static TestWebhookResponse from(SendResult result) {
    return new TestWebhookResponse(
        result.success(),
        result.statusCode(),
        result.responseTimeMillis(),
        result.responseBody(),
        result.error());
  }
}
