package com.festivalplatform.webhookservice.registry;

import com.festivalplatform.domain.webhooks.event.EventType;
import com.festivalplatform.domain.webhooks.subscription.WebhookConfig;
import com.festivalplatform.integration.webhookhttp.WebhookUrlValidator;
import com.festivalplatform.webhookservice.config.WebhookServiceProperties;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class WebhookRegistryService {
  private static final Logger log = LoggerFactory.getLogger(WebhookRegistryService.class);

  private final WebhookConfigRepository repository;
  private final SecretGenerator secretGenerator;
  private final WebhookUrlValidator urlValidator;
  private final WebhookServiceProperties properties;
  private final Clock clock;

  public WebhookRegistryService(
      WebhookConfigRepository repository,
      SecretGenerator secretGenerator,
      WebhookUrlValidator urlValidator,
      WebhookServiceProperties properties,
      Clock clock) {
    this.repository = repository;
    this.secretGenerator = secretGenerator;
    this.urlValidator = urlValidator;
    this.properties = properties;
    this.clock = clock;
  }

  /** Creates an ACTIVE webhook. The returned config carries the only plaintext copy of the secret. */
  @Transactional
  public WebhookConfig create(CreateWebhookCommand command) {
    Objects.requireNonNull(command.tenantId(), "tenantId must not be null");
    urlValidator.validateFormat(command.targetUrl());
    int maxRetries =
        command.maxRetries() == null ? properties.getDefaultMaxRetries() : command.maxRetries();
    int timeoutSeconds =
        command.timeoutSeconds() == null
            ? properties.getDefaultTimeoutSeconds()
            : command.timeoutSeconds();
    validateTimeout(timeoutSeconds);

    Instant now = clock.instant();
    WebhookConfig config =
        WebhookConfig.createNew(
            UUID.randomUUID(),
            command.tenantId(),
            command.name(),
            command.description(),
            command.targetUrl().trim(),
            secretGenerator.generate(),
            command.eventTypes(),
            command.customHeaders(),
            maxRetries,
            timeoutSeconds,
            command.createdBy(),
            now);
    repository.insert(config);
    log.info(
        "Webhook created webhook_id={} tenant_id={} event_types={}",
        config.id(),
        config.tenantId(),
        config.subscribedEventTypes());
    return config;
  }

  @Transactional(readOnly = true)
  public WebhookConfig get(UUID webhookId) {
    return repository
        .findById(webhookId)
        .orElseThrow(() -> new WebhookNotFoundException(webhookId));
  }

  @Transactional(readOnly = true)
  public List<WebhookConfig> listByTenant(UUID tenantId) {
    return repository.findByTenantId(tenantId);
  }

  @Transactional
  public WebhookConfig update(UUID webhookId, UpdateWebhookCommand command) {
    WebhookConfig current = get(webhookId);
    if (command.targetUrl() != null) {
      urlValidator.validateFormat(command.targetUrl());
    }
    if (command.timeoutSeconds() != null) {
      validateTimeout(command.timeoutSeconds());
    }
    WebhookConfig updated =
        current.patch(
            command.name(),
            command.description(),
            command.targetUrl() == null ? null : command.targetUrl().trim(),
            command.eventTypes(),
            command.customHeaders(),
            command.status(),
            command.maxRetries(),
            command.timeoutSeconds(),
            clock.instant());
    repository.updateSettings(updated, command.status());
    updated = get(webhookId);
    log.info(
        "Webhook updated webhook_id={} status={} event_types={}",
        updated.id(),
        updated.status(),
        updated.subscribedEventTypes());
    return updated;
  }

  @Transactional
  public void delete(UUID webhookId) {
    if (!repository.deleteById(webhookId)) {
      throw new WebhookNotFoundException(webhookId);
    }
    log.info("Webhook deleted webhook_id={}", webhookId);
  }

  /**
   * Replaces the signing secret. Deliveries already created keep the signature computed with the
   * previous secret.
   */
  @Transactional
  public WebhookConfig regenerateSecret(UUID webhookId) {
    WebhookConfig current = get(webhookId);
    Instant now = clock.instant();
    WebhookConfig rotated = current.withSecret(secretGenerator.generate(), now);
    repository.updateSecret(webhookId, rotated.signingSecret(), now);
    log.info("Webhook secret regenerated webhook_id={}", webhookId);
    return rotated;
  }

  @Transactional(readOnly = true)
  public List<WebhookConfig> resolveActiveSubscribers(UUID tenantId, EventType eventType) {
    return repository.findDispatchable(tenantId, eventType);
  }

  @Transactional
  public void markTriggered(UUID webhookId) {
    repository.markTriggered(webhookId, clock.instant());
  }

  @Transactional
  public void incrementFailure(UUID webhookId) {
    repository.incrementFailure(webhookId, clock.instant());
  }

  @Transactional
  public void resetFailureCount(UUID webhookId) {
    repository.resetFailureCount(webhookId, clock.instant());
  }

  private void validateTimeout(int timeoutSeconds) {
    if (timeoutSeconds < 1 || timeoutSeconds > properties.getMaxTimeoutSeconds()) {
      throw new IllegalArgumentException(
          "timeoutSeconds must be between 1 and " + properties.getMaxTimeoutSeconds());
    }
  }
}
