package com.festivalplatform.integration.webhookhttp;

public class WebhookUrlRejectedException extends RuntimeException {
  private final boolean retryable;

  public WebhookUrlRejectedException(String message) {
    this(message, false, null);
  }

  public WebhookUrlRejectedException(String message, boolean retryable, Throwable cause) {
    super(message, cause);
    this.retryable = retryable;
  }

  /** True when the URL itself is acceptable but the host could not be resolved right now. */
  public boolean retryable() {
    return retryable;
  }
}
