package com.festivalplatform.integration.webhookhttp;

public record SendResult(
    Integer statusCode,
    String responseBody,
    long responseTimeMillis,
    boolean success,
    String error,
    boolean policyRejected) {
  public SendResult {
    responseTimeMillis = Math.max(0L, responseTimeMillis);
  }

  public static SendResult response(int statusCode, String responseBody, long responseTimeMillis) {
    boolean success = statusCode >= 200 && statusCode < 300;
    return new SendResult(
        statusCode,
        responseBody,
        responseTimeMillis,
        success,
        success ? null : "HTTP " + statusCode,
        false);
  }

  public static SendResult transportFailure(String error, long responseTimeMillis) {
    return new SendResult(null, null, responseTimeMillis, false, error, false);
  }

  /** The request was refused before any network call and must not be retried. */
  public static SendResult rejected(String error) {
    return new SendResult(null, null, 0L, false, error, true);
  }

  public boolean retryable() {
    return !success && !policyRejected;
  }
}
