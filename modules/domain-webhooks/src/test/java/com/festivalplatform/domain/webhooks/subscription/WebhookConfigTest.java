package com.festivalplatform.domain.webhooks.subscription;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.festivalplatform.domain.webhooks.WebhookDomainException;
import com.festivalplatform.domain.webhooks.event.EventType;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class WebhookConfigTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Test
  void shouldBecomeFailingAfterTenConsecutiveFailures() {
    WebhookConfig config = newConfig();

    for (int i = 0; i < WebhookConfig.FAILING_THRESHOLD - 1; i++) {
      config = config.withFailureRecorded(NOW);
    }
    assertEquals(WebhookStatus.ACTIVE, config.status());

    config = config.withFailureRecorded(NOW.plusSeconds(1));

    assertEquals(WebhookStatus.FAILING, config.status());
    assertEquals(10, config.consecutiveFailureCount());
    assertEquals(NOW.plusSeconds(1), config.lastFailureAt());
    assertFalse(config.acceptsDeliveries());
  }

  @Test
  void explicitActivationShouldClearFailureCounter() {
    WebhookConfig failing = newConfig();
    for (int i = 0; i < WebhookConfig.FAILING_THRESHOLD; i++) {
      failing = failing.withFailureRecorded(NOW);
    }

    WebhookConfig renamed =
        failing.patch("Renamed", null, null, null, null, null, null, null, NOW);
    WebhookConfig reactivated =
        failing.patch(null, null, null, null, null, WebhookStatus.ACTIVE, null, null, NOW);

    assertEquals(WebhookStatus.FAILING, renamed.status());
    assertEquals(WebhookStatus.ACTIVE, reactivated.status());
    assertEquals(0, reactivated.consecutiveFailureCount());
    assertTrue(reactivated.acceptsDeliveries());
  }

  @Test
  void shouldRestoreActiveOnSuccess() {
    WebhookConfig failing = newConfig();
    for (int i = 0; i < 12; i++) {
      failing = failing.withFailureRecorded(NOW);
    }

    WebhookConfig recovered = failing.withSuccessRecorded(NOW.plusSeconds(5));

    assertEquals(WebhookStatus.ACTIVE, recovered.status());
    assertEquals(0, recovered.consecutiveFailureCount());
    assertEquals(NOW.plusSeconds(5), recovered.lastSuccessAt());
  }

  @Test
  void shouldNotReactivateDisabledWebhookOnSuccess() {
    WebhookConfig disabled =
        newConfig().patch(null, null, null, null, null, WebhookStatus.DISABLED, null, null, NOW);

    WebhookConfig afterSuccess = disabled.withSuccessRecorded(NOW);

    assertEquals(WebhookStatus.DISABLED, afterSuccess.status());
    assertFalse(afterSuccess.acceptsDeliveries());
  }

  @Test
  void shouldApplyPartialPatch() {
    WebhookConfig config = newConfig();

    WebhookConfig patched =
        config.patch(
            "Renamed",
            null,
            null,
            Set.of(EventType.WALLET_TOPUP, EventType.ORDER_PAID),
            null,
            null,
            3,
            null,
            NOW.plusSeconds(1));

    assertEquals("Renamed", patched.name());
    assertEquals(config.targetUrl(), patched.targetUrl());
    assertEquals(config.signingSecret(), patched.signingSecret());
    assertEquals(3, patched.maxRetries());
    assertEquals(30, patched.timeoutSeconds());
    assertTrue(patched.subscribesTo(EventType.WALLET_TOPUP));
    assertFalse(patched.subscribesTo(EventType.TICKET_SCANNED));
  }

  @Test
  void shouldRejectInvalidConfiguration() {
    assertThrows(
        WebhookDomainException.class,
        () ->
            WebhookConfig.createNew(
                UUID.randomUUID(),
                UUID.randomUUID(),
                "Empty",
                null,
                "https://hooks.example.com",
                "whsec_x",
                Set.of(),
                Map.of(),
                5,
                30,
                "admin",
                NOW));
    assertThrows(
        WebhookDomainException.class,
        () -> newConfig().patch(null, null, null, null, null, null, 0, null, NOW));
  }

  @Test
  void shouldNotExposeSecretInToString() {
    assertFalse(newConfig().toString().contains("whsec_supersecret"));
  }

  private static WebhookConfig newConfig() {
    return WebhookConfig.createNew(
        UUID.randomUUID(),
        UUID.randomUUID(),
        "Orders sink",
        "Receives paid orders",
        "https://hooks.example.com/orders",
        "whsec_supersecret",
        Set.of(EventType.ORDER_PAID),
        Map.of("X-Env", "test"),
        5,
        30,
        "admin",
        NOW);
  }
}
