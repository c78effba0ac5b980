package com.festivalplatform.domain.webhooks;

public class WebhookDomainException extends RuntimeException {
  public WebhookDomainException(String message) {
    super(message);
  }

  public WebhookDomainException(String message, Throwable cause) {
    super(message, cause);
  }
}
