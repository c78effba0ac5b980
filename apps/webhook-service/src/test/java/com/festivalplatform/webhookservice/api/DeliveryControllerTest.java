package com.festivalplatform.webhookservice.api;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.festivalplatform.domain.webhooks.delivery.DeliveryAttempt;
import com.festivalplatform.domain.webhooks.delivery.DeliveryStatus;
import com.festivalplatform.domain.webhooks.delivery.WebhookDelivery;
import com.festivalplatform.domain.webhooks.event.Event;
import com.festivalplatform.domain.webhooks.event.EventPayloadCodec;
import com.festivalplatform.domain.webhooks.event.EventType;
import com.festivalplatform.domain.webhooks.subscription.WebhookConfig;
import com.festivalplatform.webhookservice.delivery.DeliveryNotFoundException;
import com.festivalplatform.webhookservice.delivery.DeliveryPage;
import com.festivalplatform.webhookservice.delivery.DeliveryQueryService;
import com.festivalplatform.webhookservice.delivery.DeliveryStateConflictException;
import com.festivalplatform.webhookservice.dispatch.WebhookDispatchService;
import com.festivalplatform.webhookservice.registry.WebhookNotFoundException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = DeliveryController.class)
class DeliveryControllerTest {
  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Autowired private MockMvc mockMvc;
  @MockBean private DeliveryQueryService deliveryQueryService;
  @MockBean private WebhookDispatchService dispatchService;

  @Test
  void listShouldReturnPageWithoutSignatures() throws Exception {
    WebhookDelivery delivery = sampleDelivery();
    when(deliveryQueryService.listDeliveries(delivery.webhookId(), 2, 5))
        .thenReturn(new DeliveryPage(List.of(delivery), 2, 5, 6, 2));

    mockMvc
        .perform(
            get("/v1/webhooks/{id}/deliveries", delivery.webhookId())
                .param("page", "2")
                .param("size", "5"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.page").value(2))
        .andExpect(jsonPath("$.size").value(5))
        .andExpect(jsonPath("$.totalElements").value(6))
        .andExpect(jsonPath("$.totalPages").value(2))
        .andExpect(jsonPath("$.deliveries[0].id").value(delivery.id().toString()))
        .andExpect(jsonPath("$.deliveries[0].eventType").value("order.paid"))
        .andExpect(jsonPath("$.deliveries[0].status").value("PENDING"))
        .andExpect(jsonPath("$.deliveries[0].signature").doesNotExist());
  }

  @Test
  void listShouldUseDefaultPaging() throws Exception {
    UUID webhookId = UUID.randomUUID();
    when(deliveryQueryService.listDeliveries(eq(webhookId), anyInt(), anyInt()))
        .thenReturn(new DeliveryPage(List.of(), 1, 20, 0, 0));

    mockMvc
        .perform(get("/v1/webhooks/{id}/deliveries", webhookId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.deliveries.length()").value(0));

    verify(deliveryQueryService).listDeliveries(webhookId, 1, 20);
  }

  @Test
  void listShouldReturnNotFoundForUnknownWebhook() throws Exception {
    UUID webhookId = UUID.randomUUID();
    when(deliveryQueryService.listDeliveries(eq(webhookId), anyInt(), anyInt()))
        .thenThrow(new WebhookNotFoundException(webhookId));

    mockMvc
        .perform(get("/v1/webhooks/{id}/deliveries", webhookId))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.type").value("/problems/webhook-not-found"));
  }

  @Test
  void attemptsShouldBeListedInOrder() throws Exception {
    UUID deliveryId = UUID.randomUUID();
    when(deliveryQueryService.listAttempts(deliveryId))
        .thenReturn(
            List.of(
                new DeliveryAttempt(
                    UUID.randomUUID(), deliveryId, 1, 503, "busy", 120L, false, "HTTP 503", NOW),
                new DeliveryAttempt(
                    UUID.randomUUID(),
                    deliveryId,
                    2,
                    null,
                    null,
                    30_000L,
                    false,
                    "Request timed out",
                    NOW.plusSeconds(10))));

    mockMvc
        .perform(get("/v1/deliveries/{id}/attempts", deliveryId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2))
        .andExpect(jsonPath("$[0].attemptNumber").value(1))
        .andExpect(jsonPath("$[0].statusCode").value(503))
        .andExpect(jsonPath("$[1].attemptNumber").value(2))
        .andExpect(jsonPath("$[1].statusCode").doesNotExist())
        .andExpect(jsonPath("$[1].error").value("Request timed out"));
  }

  @Test
  void attemptsShouldReturnNotFoundForUnknownDelivery() throws Exception {
    UUID deliveryId = UUID.randomUUID();
    when(deliveryQueryService.listAttempts(deliveryId))
        .thenThrow(new DeliveryNotFoundException(deliveryId));

    mockMvc
        .perform(get("/v1/deliveries/{id}/attempts", deliveryId))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.type").value("/problems/delivery-not-found"));
  }

  @Test
  void retryShouldReturnAcceptedWithResetDelivery() throws Exception {
    WebhookDelivery delivery = sampleDelivery();
    when(dispatchService.retryDelivery(delivery.id())).thenReturn(delivery);

    mockMvc
        .perform(post("/v1/deliveries/{id}/retry", delivery.id()))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.status").value("PENDING"))
        .andExpect(jsonPath("$.attemptCount").value(0));
  }

  @Test
  void retryShouldReturnConflictForDeliveredDelivery() throws Exception {
    UUID deliveryId = UUID.randomUUID();
    when(dispatchService.retryDelivery(deliveryId))
        .thenThrow(
            new DeliveryStateConflictException(
                deliveryId, DeliveryStatus.DELIVERED, "Delivery was already successful"));

    mockMvc
        .perform(post("/v1/deliveries/{id}/retry", deliveryId))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.type").value("/problems/delivery-state-conflict"))
        .andExpect(jsonPath("$.status").value(409))
        .andExpect(jsonPath("$.deliveryStatus").value("DELIVERED"));
  }

  private static WebhookDelivery sampleDelivery() {
    WebhookConfig config =
        WebhookConfig.createNew(
            UUID.randomUUID(),
            UUID.randomUUID(),
            "Festival ERP",
            null,
            "https://erp.example.com/hooks",
            "whsec_" + "ab".repeat(32),
            Set.of(EventType.ORDER_PAID),
            Map.of(),
            5,
            30,
            null,
            NOW);
    Event event = Event.of(EventType.ORDER_PAID, config.tenantId(), Map.of("order_id", "ord-1"), NOW);
    return WebhookDelivery.create(
        UUID.randomUUID(), config, event, new EventPayloadCodec(), "2024-01-01", NOW);
  }
}
