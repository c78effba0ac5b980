package com.festivalplatform.webhookservice.api;

import com.festivalplatform.domain.webhooks.event.EventType;
import com.festivalplatform.domain.webhooks.subscription.WebhookConfig;
import com.festivalplatform.integration.webhookhttp.SendResult;
import com.festivalplatform.webhookservice.delivery.DeliveryQueryService;
import com.festivalplatform.webhookservice.delivery.DeliveryStats;
import com.festivalplatform.webhookservice.dispatch.WebhookDispatchService;
import com.festivalplatform.webhookservice.registry.CreateWebhookCommand;
import com.festivalplatform.webhookservice.registry.UpdateWebhookCommand;
import com.festivalplatform.webhookservice.registry.WebhookRegistryService;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
public class WebhookController {
  private final WebhookRegistryService registryService;
  private final WebhookDispatchService dispatchService;
  private final DeliveryQueryService deliveryQueryService;

  public WebhookController(
      WebhookRegistryService registryService,
      WebhookDispatchService dispatchService,
      DeliveryQueryService deliveryQueryService) {
    this.registryService = registryService;
    this.dispatchService = dispatchService;
    this.deliveryQueryService = deliveryQueryService;
  }

  @PostMapping("/tenants/{tenantId}/webhooks")
  public ResponseEntity<WebhookCreatedResponse> createWebhook(
      @PathVariable("tenantId") UUID tenantId, @Valid @RequestBody CreateWebhookRequest request) {
    WebhookConfig created =
        registryService.create(
            new CreateWebhookCommand(
                tenantId,
                request.name(),
                request.description(),
                request.url(),
                parseEventTypes(request.events()),
                request.headers(),
                request.maxRetries(),
                request.timeoutSeconds(),
                request.createdBy()));
    return ResponseEntity.status(HttpStatus.CREATED).body(WebhookCreatedResponse.from(created));
  }

  @GetMapping("/tenants/{tenantId}/webhooks")
  public ResponseEntity<List<WebhookResponse>> listWebhooks(
      @PathVariable("tenantId") UUID tenantId) {
    return ResponseEntity.ok(
        registryService.listByTenant(tenantId).stream().map(WebhookResponse::from).toList());
  }

  @GetMapping("/tenants/{tenantId}/webhooks/stats")
  public ResponseEntity<DeliveryStatsResponse> tenantStats(
      @PathVariable("tenantId") UUID tenantId,
      @RequestParam(name = "since", required = false) Instant since) {
    Instant window = deliveryQueryService.resolveSince(since);
    DeliveryStats stats = deliveryQueryService.tenantStats(tenantId, window);
    return ResponseEntity.ok(DeliveryStatsResponse.from(stats, window));
  }

  @GetMapping("/webhooks/{id}")
  public ResponseEntity<WebhookResponse> getWebhook(@PathVariable("id") UUID id) {
    return ResponseEntity.ok(WebhookResponse.from(registryService.get(id)));
  }

  @PatchMapping("/webhooks/{id}")
  public ResponseEntity<WebhookResponse> updateWebhook(
      @PathVariable("id") UUID id, @Valid @RequestBody UpdateWebhookRequest request) {
    WebhookConfig updated =
        registryService.update(
            id,
            new UpdateWebhookCommand(
                request.name(),
                request.description(),
                request.url(),
                request.events() == null ? null : parseEventTypes(request.events()),
                request.headers(),
                request.status(),
                request.maxRetries(),
                request.timeoutSeconds()));
    return ResponseEntity.ok(WebhookResponse.from(updated));
  }

  @DeleteMapping("/webhooks/{id}")
  public ResponseEntity<Void> deleteWebhook(@PathVariable("id") UUID id) {
    registryService.delete(id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/webhooks/{id}/regenerate-secret")
  public ResponseEntity<SecretResponse> regenerateSecret(@PathVariable("id") UUID id) {
    WebhookConfig rotated = registryService.regenerateSecret(id);
    return ResponseEntity.ok(new SecretResponse(rotated.id(), rotated.signingSecret()));
  }

  @PostMapping("/webhooks/{id}/test")
  public ResponseEntity<TestWebhookResponse> testWebhook(
      @PathVariable("id") UUID id, @RequestBody(required = false) TestWebhookRequest request) {
    EventType eventType =
        request == null || request.eventType() == null
            ? null
            : EventType.requireWireName(request.eventType());
    SendResult result =
        dispatchService.testWebhook(id, eventType, request == null ? null : request.data());
    return ResponseEntity.ok(TestWebhookResponse.from(result));
  }

  @GetMapping("/webhooks/{id}/stats")
  public ResponseEntity<DeliveryStatsResponse> webhookStats(
      @PathVariable("id") UUID id,
      @RequestParam(name = "since", required = false) Instant since) {
    Instant window = deliveryQueryService.resolveSince(since);
    DeliveryStats stats = deliveryQueryService.webhookStats(id, window);
    return ResponseEntity.ok(DeliveryStatsResponse.from(stats, window));
  }

  private static Set<EventType> parseEventTypes(List<String> wireNames) {
    Set<EventType> types = EnumSet.noneOf(EventType.class);
    for (String wireName : wireNames) {
      types.add(EventType.requireWireName(wireName));
    }
    return types;
  }
}
