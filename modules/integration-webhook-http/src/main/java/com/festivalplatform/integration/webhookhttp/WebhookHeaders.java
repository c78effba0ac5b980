package com.festivalplatform.integration.webhookhttp;

public final class WebhookHeaders {
  public static final String CONTENT_TYPE = "Content-Type";
  public static final String USER_AGENT = "User-Agent";
  public static final String SIGNATURE = "X-Webhook-Signature";
  public static final String EVENT_ID = "X-Webhook-Event-ID";
  public static final String EVENT_TYPE = "X-Webhook-Event-Type";
  public static final String DELIVERY_ID = "X-Webhook-Delivery-ID";
  public static final String TIMESTAMP = "X-Webhook-Timestamp";

  public static final String JSON_CONTENT_TYPE = "application/json";

  private WebhookHeaders() {}
}
