package com.festivalplatform.domain.webhooks.signature;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Signature header format: {@code t=<unix seconds>,v1=<hex HMAC-SHA256>}, computed over {@code
 * "<unix seconds>.<payload>"}.
 */
public final class WebhookSignatures {
  public static final String HEADER_NAME = "X-Webhook-Signature";
  public static final Duration DEFAULT_TOLERANCE = Duration.ofMinutes(5);

  private static final String ALGORITHM = "HmacSHA256";
  private static final String TIMESTAMP_PREFIX = "t=";
  private static final String SIGNATURE_PREFIX = "v1=";

  private WebhookSignatures() {}

  public static String generate(byte[] payload, String secret, Instant timestamp) {
    Objects.requireNonNull(payload, "payload must not be null");
    Objects.requireNonNull(timestamp, "timestamp must not be null");
    if (secret == null || secret.isEmpty()) {
      throw new IllegalStateException("Signing secret must not be empty");
    }
    long unixSeconds = timestamp.getEpochSecond();
    return TIMESTAMP_PREFIX
        + unixSeconds
        + ","
        + SIGNATURE_PREFIX
        + hmacSha256Hex(payload, secret, unixSeconds);
  }

  public static boolean verify(
      byte[] payload, String signatureHeader, String secret, Duration tolerance, Clock clock) {
    if (payload == null
        || signatureHeader == null
        || secret == null
        || secret.isEmpty()
        || tolerance == null
        || clock == null) {
      return false;
    }
    Long unixSeconds = null;
    String expectedHex = null;
    for (String part : signatureHeader.split(",")) {
      String trimmed = part.trim();
      if (trimmed.startsWith(TIMESTAMP_PREFIX)) {
        unixSeconds = parseSeconds(trimmed.substring(TIMESTAMP_PREFIX.length()));
      } else if (trimmed.startsWith(SIGNATURE_PREFIX)) {
        expectedHex = trimmed.substring(SIGNATURE_PREFIX.length());
      }
    }
    if (unixSeconds == null || expectedHex == null || expectedHex.isEmpty()) {
      return false;
    }
    long age = clock.instant().getEpochSecond() - unixSeconds;
    if (age > tolerance.getSeconds()) {
      return false;
    }
    String actualHex;
    try {
      actualHex = hmacSha256Hex(payload, secret, unixSeconds);
    } catch (IllegalStateException ex) {
      return false;
    }
    return MessageDigest.isEqual(
        actualHex.getBytes(StandardCharsets.US_ASCII),
        expectedHex.getBytes(StandardCharsets.US_ASCII));
  }

  private static Long parseSeconds(String raw) {
    try {
      return Long.parseLong(raw);
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  private static String hmacSha256Hex(byte[] payload, String secret, long unixSeconds) {
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
      mac.update((unixSeconds + ".").getBytes(StandardCharsets.UTF_8));
      byte[] signatureBytes = mac.doFinal(payload);
      StringBuilder hex = new StringBuilder(signatureBytes.length * 2);
      for (byte b : signatureBytes) {
        hex.append(Character.forDigit((b >> 4) & 0xF, 16));
        hex.append(Character.forDigit(b & 0xF, 16));
      }
      return hex.toString();
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("Failed to compute webhook signature", ex);
    }
  }
}
