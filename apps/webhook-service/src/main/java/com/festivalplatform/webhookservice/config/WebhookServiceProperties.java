package com.festivalplatform.webhookservice.config;

import com.festivalplatform.domain.webhooks.event.Event;
import com.festivalplatform.integration.webhookhttp.WebhookSenderConfig;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "webhooks")
public class WebhookServiceProperties {
  private String apiVersion = Event.DEFAULT_API_VERSION;
  private int defaultMaxRetries = 5;
  private int defaultTimeoutSeconds = 30;
  private int maxTimeoutSeconds = 120;
  private int secretLengthBytes = 32;
  private Sender sender = new Sender();
  private Retry retry = new Retry();
  private Sweeper sweeper = new Sweeper();
  private Retention retention = new Retention();

  public String getApiVersion() {
    return apiVersion;
  }

  public void setApiVersion(String apiVersion) {
    this.apiVersion = apiVersion;
  }

  public int getDefaultMaxRetries() {
    return defaultMaxRetries;
  }

  public void setDefaultMaxRetries(int defaultMaxRetries) {
    this.defaultMaxRetries = defaultMaxRetries;
  }

  public int getDefaultTimeoutSeconds() {
    return defaultTimeoutSeconds;
  }

  public void setDefaultTimeoutSeconds(int defaultTimeoutSeconds) {
    this.defaultTimeoutSeconds = defaultTimeoutSeconds;
  }

  public int getMaxTimeoutSeconds() {
    return maxTimeoutSeconds;
  }

  public void setMaxTimeoutSeconds(int maxTimeoutSeconds) {
    this.maxTimeoutSeconds = maxTimeoutSeconds;
  }

  public int getSecretLengthBytes() {
    return secretLengthBytes;
  }

  public void setSecretLengthBytes(int secretLengthBytes) {
    this.secretLengthBytes = secretLengthBytes;
  }

  public Sender getSender() {
    return sender;
  }

  public void setSender(Sender sender) {
    this.sender = sender;
  }

  public Retry getRetry() {
    return retry;
  }

  public void setRetry(Retry retry) {
    this.retry = retry;
  }

  public Sweeper getSweeper() {
    return sweeper;
  }

  public void setSweeper(Sweeper sweeper) {
    this.sweeper = sweeper;
  }

  public Retention getRetention() {
    return retention;
  }

  public void setRetention(Retention retention) {
    this.retention = retention;
  }

  public static class Sender {
    private String userAgent = WebhookSenderConfig.DEFAULT_USER_AGENT;
    // Local development only: permits http:// and private addresses.
    private boolean allowInsecure = false;
    private int responseBodyLimitBytes = WebhookSenderConfig.DEFAULT_MAX_RESPONSE_BODY_BYTES;
    private Duration connectTimeout = Duration.ofSeconds(10);

    public String getUserAgent() {
      return userAgent;
    }

    public void setUserAgent(String userAgent) {
      this.userAgent = userAgent;
    }

    public boolean isAllowInsecure() {
      return allowInsecure;
    }

    public void setAllowInsecure(boolean allowInsecure) {
      this.allowInsecure = allowInsecure;
    }

    public int getResponseBodyLimitBytes() {
      return responseBodyLimitBytes;
    }

    public void setResponseBodyLimitBytes(int responseBodyLimitBytes) {
      this.responseBodyLimitBytes = responseBodyLimitBytes;
    }

    public Duration getConnectTimeout() {
      return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
    }
  }

  public static class Retry {
    private Duration baseDelay = Duration.ofSeconds(10);
    private double multiplier = 2.0d;
    private Duration maxDelay = Duration.ofMinutes(5);
    private double jitterRatio = 0.1d;

    public Duration getBaseDelay() {
      return baseDelay;
    }

    public void setBaseDelay(Duration baseDelay) {
      this.baseDelay = baseDelay;
    }

    public double getMultiplier() {
      return multiplier;
    }

    public void setMultiplier(double multiplier) {
      this.multiplier = multiplier;
    }

    public Duration getMaxDelay() {
      return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
    }

    public double getJitterRatio() {
      return jitterRatio;
    }

    public void setJitterRatio(double jitterRatio) {
      this.jitterRatio = jitterRatio;
    }
  }

  public static class Sweeper {
    private boolean enabled = true;
    private int batchSize = 100;
    private long pendingDelayMs = 30_000L;
    private long retryDelayMs = 15_000L;
    // PENDING rows younger than this are still owned by the dispatch path.
    private long pendingGraceMs = 60_000L;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public long getPendingDelayMs() {
      return pendingDelayMs;
    }

    public void setPendingDelayMs(long pendingDelayMs) {
      this.pendingDelayMs = pendingDelayMs;
    }

    public long getRetryDelayMs() {
      return retryDelayMs;
    }

    public void setRetryDelayMs(long retryDelayMs) {
      this.retryDelayMs = retryDelayMs;
    }

    public long getPendingGraceMs() {
      return pendingGraceMs;
    }

    public void setPendingGraceMs(long pendingGraceMs) {
      this.pendingGraceMs = pendingGraceMs;
    }
  }

  public static class Retention {
    private int days = 30;
    private String cleanupCron = "0 30 3 * * *";

    public int getDays() {
      return days;
    }

    public void setDays(int days) {
      this.days = days;
    }

    public String getCleanupCron() {
      return cleanupCron;
    }

    public void setCleanupCron(String cleanupCron) {
      this.cleanupCron = cleanupCron;
    }
  }
}
