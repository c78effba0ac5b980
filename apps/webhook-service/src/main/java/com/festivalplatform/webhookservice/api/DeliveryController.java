package com.festivalplatform.webhookservice.api;

import com.festivalplatform.domain.webhooks.delivery.WebhookDelivery;
import com.festivalplatform.webhookservice.delivery.DeliveryPage;
import com.festivalplatform.webhookservice.delivery.DeliveryQueryService;
import com.festivalplatform.webhookservice.dispatch.WebhookDispatchService;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
public class DeliveryController {
  private final DeliveryQueryService deliveryQueryService;
  private final WebhookDispatchService dispatchService;

  public DeliveryController(
      DeliveryQueryService deliveryQueryService, WebhookDispatchService dispatchService) {
    this.deliveryQueryService = deliveryQueryService;
    this.dispatchService = dispatchService;
  }

  @GetMapping("/webhooks/{id}/deliveries")
  public ResponseEntity<DeliveriesPageResponse> listDeliveries(
      @PathVariable("id") UUID webhookId,
      @RequestParam(name = "page", defaultValue = "1") int page,
      @RequestParam(name = "size", defaultValue = "20") int size) {
    DeliveryPage result = deliveryQueryService.listDeliveries(webhookId, page, size);
    List<DeliveryResponse> deliveries =
        result.deliveries().stream().map(DeliveryResponse::from).toList();
    return ResponseEntity.ok(
        new DeliveriesPageResponse(
            deliveries, result.page(), result.size(), result.totalElements(), result.totalPages()));
  }

  @GetMapping("/deliveries/{id}/attempts")
  public ResponseEntity<List<DeliveryAttemptResponse>> listAttempts(
      @PathVariable("id") UUID deliveryId) {
    return ResponseEntity.ok(
        deliveryQueryService.listAttempts(deliveryId).stream()
            .map(DeliveryAttemptResponse::from)
            .toList());
  }

  @PostMapping("/deliveries/{id}/retry")
  public ResponseEntity<DeliveryResponse> retryDelivery(@PathVariable("id") UUID deliveryId) {
    WebhookDelivery reset = dispatchService.retryDelivery(deliveryId);
    return ResponseEntity.accepted().body(DeliveryResponse.from(reset));
  }
}
