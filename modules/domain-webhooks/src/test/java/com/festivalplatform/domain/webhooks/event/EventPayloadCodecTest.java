package com.festivalplatform.domain.webhooks.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.festivalplatform.domain.webhooks.event.payload.OrderPaidV1;
import com.festivalplatform.domain.webhooks.event.payload.WalletTopupV1;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class EventPayloadCodecTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00.123Z");

  private final EventPayloadCodec codec = new EventPayloadCodec();

  @Test
  void shouldEncodeStableWireShape() throws Exception {
    UUID tenantId = UUID.randomUUID();
    OrderPaidV1 paid =
        new OrderPaidV1(
            "ord-1", "usr-9", new BigDecimal("42.50"), "EUR", "wallet", "pay-77", NOW);
    Event event = codec.newEvent(EventType.ORDER_PAID, tenantId, paid, NOW);

    byte[] body = codec.encode(event.toPayload(Event.DEFAULT_API_VERSION));
    JsonNode json = new ObjectMapper().readTree(body);

    assertEquals(event.id().toString(), json.get("id").asText());
    assertEquals("order.paid", json.get("type").asText());
    assertEquals(tenantId.toString(), json.get("tenant_id").asText());
    assertEquals("2026-03-01T12:00:00Z", json.get("timestamp").asText());
    assertEquals("2024-01-01", json.get("api_version").asText());
    assertEquals("ord-1", json.get("data").get("order_id").asText());
    assertEquals("wallet", json.get("data").get("payment_method").asText());
    assertEquals(0, new BigDecimal("42.5").compareTo(json.get("data").get("amount").decimalValue()));
    assertTrue(json.get("data").has("paid_at"));
  }

  @Test
  void shouldDecodeWhatItEncodes() {
    Event event =
        Event.of(EventType.TICKET_SCANNED, UUID.randomUUID(), Map.of("ticket_id", "t-1"), NOW);
    EventPayload payload = event.toPayload("2025-06-01");

    String json = new String(codec.encode(payload), StandardCharsets.UTF_8);
    EventPayload decoded = codec.decode(json);

    assertEquals(payload, decoded);
  }

  @Test
  void shouldRejectPayloadThatDoesNotMatchEventType() {
    WalletTopupV1 topup =
        new WalletTopupV1(
            "w-1", "u-1", BigDecimal.TEN, "EUR", BigDecimal.TEN, "card", NOW);

    assertThrows(
        IllegalArgumentException.class,
        () -> codec.newEvent(EventType.ORDER_PAID, UUID.randomUUID(), topup, NOW));
  }

  @Test
  void shouldResolveWireNames() {
    assertEquals(EventType.INVENTORY_LOW_STOCK, EventType.requireWireName("inventory.low_stock"));
    assertEquals(EventCategory.WALLET, EventType.WALLET_PAYMENT.category());
    assertFalse(EventType.fromWireName("order.shipped").isPresent());
    assertThrows(IllegalArgumentException.class, () -> EventType.requireWireName("nope"));
  }
}
