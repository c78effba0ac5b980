package com.festivalplatform.domain.webhooks.delivery;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/** Exponential retry delay with symmetric jitter, capped at {@code maxDelay}. */
public class DeliveryBackoff {
  public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(10);
  public static final double DEFAULT_MULTIPLIER = 2.0d;
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofMinutes(5);
  public static final double DEFAULT_JITTER_RATIO = 0.1d;

  private final long baseDelayMs;
  private final double multiplier;
  private final long maxDelayMs;
  private final double jitterRatio;
  private final DoubleSupplier jitterSource;

  public DeliveryBackoff(
      Duration baseDelay, double multiplier, Duration maxDelay, double jitterRatio) {
    this(
        baseDelay,
        multiplier,
        maxDelay,
        jitterRatio,
        () -> ThreadLocalRandom.current().nextDouble());
  }

  public DeliveryBackoff(
      Duration baseDelay,
      double multiplier,
      Duration maxDelay,
      double jitterRatio,
      DoubleSupplier jitterSource) {
    Objects.requireNonNull(baseDelay, "baseDelay must not be null");
    Objects.requireNonNull(maxDelay, "maxDelay must not be null");
    this.baseDelayMs = Math.max(0L, baseDelay.toMillis());
    this.multiplier = Math.max(1.0d, multiplier);
    this.maxDelayMs = Math.max(this.baseDelayMs, maxDelay.toMillis());
    this.jitterRatio = Math.max(0.0d, Math.min(1.0d, jitterRatio));
    this.jitterSource = Objects.requireNonNull(jitterSource, "jitterSource must not be null");
  }

  public static DeliveryBackoff defaults() {
    return new DeliveryBackoff(
        DEFAULT_BASE_DELAY, DEFAULT_MULTIPLIER, DEFAULT_MAX_DELAY, DEFAULT_JITTER_RATIO);
  }

  public Duration delayForAttempt(int attempt) {
    long deterministic = deterministicDelay(attempt);
    if (jitterRatio == 0.0d || deterministic == 0L) {
      return Duration.ofMillis(deterministic);
    }
    double sample = Math.max(0.0d, Math.min(1.0d, jitterSource.getAsDouble()));
    double factor = 1.0d + (sample * 2.0d - 1.0d) * jitterRatio;
    long jittered = (long) Math.floor(deterministic * factor);
    return Duration.ofMillis(Math.max(0L, Math.min(maxDelayMs, jittered)));
  }

  public Duration maxDelay() {
    return Duration.ofMillis(maxDelayMs);
  }

  long deterministicDelay(int attempt) {
    if (baseDelayMs == 0L) {
      return 0L;
    }
    int exponent = Math.max(0, attempt - 1);
    double scaled = baseDelayMs * Math.pow(multiplier, exponent);
    long bounded = (long) Math.floor(Math.min((double) maxDelayMs, scaled));
    return Math.max(0L, bounded);
  }
}
