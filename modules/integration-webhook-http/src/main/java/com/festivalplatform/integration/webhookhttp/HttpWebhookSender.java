package com.festivalplatform.integration.webhookhttp;

import com.festivalplatform.domain.webhooks.delivery.WebhookDelivery;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class HttpWebhookSender implements WebhookSender {
  private static final Logger log = LoggerFactory.getLogger(HttpWebhookSender.class);

  // Headers java.net.http refuses to let callers set.
  private static final Set<String> RESTRICTED_HEADERS =
      Set.of("connection", "content-length", "expect", "host", "upgrade");

  private final HttpClient httpClient;
  private final WebhookSenderConfig config;
  private final WebhookUrlValidator urlValidator;
  private final BoundedBodyHandler bodyHandler;

  public HttpWebhookSender(WebhookSenderConfig config, WebhookUrlValidator urlValidator) {
    this(createHttpClient(config), config, urlValidator);
  }

  public HttpWebhookSender(
      HttpClient httpClient, WebhookSenderConfig config, WebhookUrlValidator urlValidator) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
    this.config = Objects.requireNonNull(config, "config must not be null");
    this.urlValidator = Objects.requireNonNull(urlValidator, "urlValidator must not be null");
    this.bodyHandler = new BoundedBodyHandler(config.maxResponseBodyBytes());
  }

  /** One pooled client per process; redirects are returned to the caller, never followed. */
  public static HttpClient createHttpClient(WebhookSenderConfig config) {
    return HttpClient.newBuilder()
        .version(HttpClient.Version.HTTP_1_1)
        .followRedirects(HttpClient.Redirect.NEVER)
        .connectTimeout(config.connectTimeout())
        .build();
  }

  @Override
  public SendResult send(
      WebhookDelivery delivery, Map<String, String> customHeaders, Duration timeout) {
    Objects.requireNonNull(delivery, "delivery must not be null");
    URI target;
    try {
      target = urlValidator.validate(delivery.targetUrl());
    } catch (WebhookUrlRejectedException ex) {
      if (ex.retryable()) {
        log.warn(
            "Webhook host resolution failed delivery_id={} webhook_id={} error={}",
            delivery.id(),
            delivery.webhookId(),
            ex.getMessage());
        return SendResult.transportFailure(ex.getMessage(), 0L);
      }
      log.warn(
          "Webhook delivery policy_rejected delivery_id={} webhook_id={} reason={}",
          delivery.id(),
          delivery.webhookId(),
          ex.getMessage());
      return SendResult.rejected(ex.getMessage());
    }

    Duration effectiveTimeout = effectiveTimeout(timeout);
    HttpRequest request;
    try {
      HttpRequest.Builder builder =
          HttpRequest.newBuilder(target)
              .timeout(effectiveTimeout)
              .POST(
                  HttpRequest.BodyPublishers.ofString(
                      delivery.payload(), StandardCharsets.UTF_8));
      buildHeaders(delivery, customHeaders).forEach(builder::header);
      request = builder.build();
    } catch (IllegalArgumentException ex) {
      log.warn(
          "Webhook delivery policy_rejected delivery_id={} webhook_id={} reason={}",
          delivery.id(),
          delivery.webhookId(),
          ex.getMessage());
      return SendResult.rejected("Invalid webhook request: " + ex.getMessage());
    }

    return execute(delivery, request, effectiveTimeout);
  }

  Map<String, String> buildHeaders(WebhookDelivery delivery, Map<String, String> customHeaders) {
    TreeMap<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    headers.put(WebhookHeaders.CONTENT_TYPE, WebhookHeaders.JSON_CONTENT_TYPE);
    headers.put(WebhookHeaders.USER_AGENT, config.userAgent());
    headers.put(WebhookHeaders.SIGNATURE, delivery.signature());
    headers.put(WebhookHeaders.EVENT_ID, delivery.eventId().toString());
    headers.put(WebhookHeaders.EVENT_TYPE, delivery.eventType().wireName());
    headers.put(WebhookHeaders.DELIVERY_ID, delivery.id().toString());
    headers.put(WebhookHeaders.TIMESTAMP, String.valueOf(delivery.createdAt().getEpochSecond()));
    if (customHeaders != null) {
      customHeaders.forEach(
          (name, value) -> {
            if (name == null || name.isBlank() || value == null) {
              return;
            }
            if (RESTRICTED_HEADERS.contains(name.trim().toLowerCase(Locale.ROOT))) {
              log.warn(
                  "Skipping restricted custom webhook header delivery_id={} header={}",
                  delivery.id(),
                  name);
              return;
            }
            headers.put(name.trim(), value);
          });
    }
    return headers;
  }

  private SendResult execute(WebhookDelivery delivery, HttpRequest request, Duration timeout) {
    long startedNanos = System.nanoTime();
    CompletableFuture<HttpResponse<String>> exchange = httpClient.sendAsync(request, bodyHandler);
    try {
      HttpResponse<String> response = exchange.get();
      return SendResult.response(
          response.statusCode(), response.body(), elapsedMillis(startedNanos));
    } catch (InterruptedException ex) {
      exchange.cancel(true);
      Thread.currentThread().interrupt();
      log.warn("Webhook request interrupted delivery_id={}", delivery.id());
      return SendResult.transportFailure(
          "Webhook request was interrupted", elapsedMillis(startedNanos));
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      return SendResult.transportFailure(describe(cause, timeout), elapsedMillis(startedNanos));
    }
  }

  private Duration effectiveTimeout(Duration timeout) {
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      return config.defaultTimeout();
    }
    return timeout;
  }

  private static String describe(Throwable cause, Duration timeout) {
    if (cause instanceof HttpTimeoutException) {
      return "Webhook request timed out after " + timeout.toMillis() + "ms";
    }
    if (cause instanceof IOException) {
      String message = cause.getMessage();
      return "Webhook request failed: "
          + cause.getClass().getSimpleName()
          + (message == null ? "" : " " + message);
    }
    return "Webhook request failed: " + cause;
  }

  private static long elapsedMillis(long startedNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
  }
}
