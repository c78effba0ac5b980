package com.festivalplatform.webhookservice.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.festivalplatform.domain.webhooks.WebhookDomainException;
import com.festivalplatform.domain.webhooks.event.EventType;
import com.festivalplatform.domain.webhooks.subscription.WebhookConfig;
import com.festivalplatform.domain.webhooks.subscription.WebhookStatus;
import com.festivalplatform.integration.webhookhttp.WebhookUrlRejectedException;
import com.festivalplatform.integration.webhookhttp.WebhookUrlValidator;
import com.festivalplatform.webhookservice.config.WebhookServiceProperties;
import com.festivalplatform.webhookservice.support.InMemoryWebhookConfigRepository;
import com.festivalplatform.webhookservice.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WebhookRegistryServiceTest {
  private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

  private final UUID tenantId = UUID.randomUUID();

  private MutableClock clock;
  private InMemoryWebhookConfigRepository repository;
  private WebhookRegistryService service;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    repository = new InMemoryWebhookConfigRepository();
    service =
        new WebhookRegistryService(
            repository,
            new SecretGenerator(32),
            new WebhookUrlValidator(false),
            new WebhookServiceProperties(),
            clock);
  }

  @Test
  void shouldCreateActiveWebhookWithDefaults() {
    WebhookConfig created = service.create(command("https://erp.example.com/hooks ", null, null));

    assertEquals(WebhookStatus.ACTIVE, created.status());
    assertEquals("https://erp.example.com/hooks", created.targetUrl());
    assertEquals(5, created.maxRetries());
    assertEquals(30, created.timeoutSeconds());
    assertEquals(0, created.consecutiveFailureCount());
    assertEquals(START, created.createdAt());
    assertTrue(created.signingSecret().matches("whsec_[0-9a-f]{64}"));
    assertEquals(created, repository.findById(created.id()).orElseThrow());
  }

  @Test
  void shouldGenerateDistinctSecrets() {
    WebhookConfig first = service.create(command("https://erp.example.com/a", null, null));
    WebhookConfig second = service.create(command("https://erp.example.com/b", null, null));

    assertNotEquals(first.signingSecret(), second.signingSecret());
  }

  @Test
  void shouldRejectPlainHttpUrl() {
    assertThrows(
        WebhookUrlRejectedException.class,
        () -> service.create(command("http://erp.example.com/hooks", null, null)));
    assertTrue(repository.findByTenantId(tenantId).isEmpty());
  }

  @Test
  void shouldRejectTimeoutOutsideBounds() {
    assertThrows(
        IllegalArgumentException.class,
        () -> service.create(command("https://erp.example.com/hooks", null, 121)));
    assertThrows(
        IllegalArgumentException.class,
        () -> service.create(command("https://erp.example.com/hooks", null, 0)));
  }

  @Test
  void shouldRejectMaxRetriesAboveLimit() {
    assertThrows(
        WebhookDomainException.class,
        () -> service.create(command("https://erp.example.com/hooks", 11, null)));
  }

  @Test
  void shouldPatchOnlyProvidedFields() {
    WebhookConfig created = service.create(command("https://erp.example.com/hooks", 3, 10));
    clock.advance(Duration.ofMinutes(1));

    WebhookConfig updated =
        service.update(
            created.id(),
            new UpdateWebhookCommand(
                "Renamed",
                null,
                null,
                Set.of(EventType.TICKET_SCANNED),
                null,
                WebhookStatus.INACTIVE,
                null,
                null));

    assertEquals("Renamed", updated.name());
    assertEquals(created.targetUrl(), updated.targetUrl());
    assertEquals(Set.of(EventType.TICKET_SCANNED), updated.subscribedEventTypes());
    assertEquals(WebhookStatus.INACTIVE, updated.status());
    assertEquals(3, updated.maxRetries());
    assertEquals(10, updated.timeoutSeconds());
    assertEquals(created.signingSecret(), updated.signingSecret());
    assertEquals(START.plusSeconds(60), updated.updatedAt());
    assertEquals(updated, repository.findById(created.id()).orElseThrow());
  }

  @Test
  void shouldThrowNotFoundForUnknownWebhook() {
    UUID unknown = UUID.randomUUID();

    assertThrows(WebhookNotFoundException.class, () -> service.get(unknown));
    assertThrows(WebhookNotFoundException.class, () -> service.delete(unknown));
    assertThrows(WebhookNotFoundException.class, () -> service.regenerateSecret(unknown));
  }

  @Test
  void shouldRegenerateSecret() {
    WebhookConfig created = service.create(command("https://erp.example.com/hooks", null, null));

    WebhookConfig rotated = service.regenerateSecret(created.id());

    assertNotEquals(created.signingSecret(), rotated.signingSecret());
    assertEquals(
        rotated.signingSecret(), repository.findById(created.id()).orElseThrow().signingSecret());
  }

  @Test
  void shouldResolveOnlyDispatchableSubscribers() {
    WebhookConfig active = service.create(command("https://erp.example.com/a", null, null));
    WebhookConfig failing = service.create(command("https://erp.example.com/b", null, null));
    WebhookConfig inactive = service.create(command("https://erp.example.com/c", null, null));
    for (int i = 0; i < WebhookConfig.FAILING_THRESHOLD; i++) {
      service.incrementFailure(failing.id());
    }
    service.update(
        inactive.id(),
        new UpdateWebhookCommand(null, null, null, null, null, WebhookStatus.INACTIVE, null, null));

    List<WebhookConfig> subscribers =
        service.resolveActiveSubscribers(tenantId, EventType.ORDER_PAID);

    assertEquals(WebhookStatus.FAILING, service.get(failing.id()).status());
    assertEquals(List.of(active.id()), subscribers.stream().map(WebhookConfig::id).toList());
    assertTrue(service.resolveActiveSubscribers(tenantId, EventType.WALLET_TOPUP).isEmpty());
  }

  @Test
  void reactivatingFailingWebhookShouldResumeDispatch() {
    WebhookConfig created = service.create(command("https://erp.example.com/hooks", null, null));
    for (int i = 0; i < WebhookConfig.FAILING_THRESHOLD; i++) {
      service.incrementFailure(created.id());
    }
    service.update(
        created.id(),
        new UpdateWebhookCommand("Renamed", null, null, null, null, null, null, null));
    assertEquals(WebhookStatus.FAILING, service.get(created.id()).status());
    assertTrue(service.resolveActiveSubscribers(tenantId, EventType.ORDER_PAID).isEmpty());

    WebhookConfig reactivated =
        service.update(
            created.id(),
            new UpdateWebhookCommand(null, null, null, null, null, WebhookStatus.ACTIVE, null, null));

    assertEquals(WebhookStatus.ACTIVE, reactivated.status());
    assertEquals(0, reactivated.consecutiveFailureCount());
    assertEquals(1, service.resolveActiveSubscribers(tenantId, EventType.ORDER_PAID).size());
  }

  @Test
  void successShouldRestoreFailingWebhook() {
    WebhookConfig created = service.create(command("https://erp.example.com/hooks", null, null));
    for (int i = 0; i < WebhookConfig.FAILING_THRESHOLD; i++) {
      service.incrementFailure(created.id());
    }

    service.resetFailureCount(created.id());

    WebhookConfig restored = service.get(created.id());
    assertEquals(WebhookStatus.ACTIVE, restored.status());
    assertEquals(0, restored.consecutiveFailureCount());
    assertEquals(START, restored.lastSuccessAt());
  }

  @Test
  void shouldDeleteWebhook() {
    WebhookConfig created = service.create(command("https://erp.example.com/hooks", null, null));

    service.delete(created.id());

    assertTrue(repository.findById(created.id()).isEmpty());
  }

  private CreateWebhookCommand command(String url, Integer maxRetries, Integer timeoutSeconds) {
    return new CreateWebhookCommand(
        tenantId,
        "Festival ERP",
        "Order sync",
        url,
        Set.of(EventType.ORDER_PAID, EventType.ORDER_REFUNDED),
        Map.of(),
        maxRetries,
        timeoutSeconds,
        "admin@example.com");
  }
}
