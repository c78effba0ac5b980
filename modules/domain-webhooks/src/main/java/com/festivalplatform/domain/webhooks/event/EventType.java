package com.festivalplatform.domain.webhooks.event;

import com.festivalplatform.domain.webhooks.event.payload.InventoryLowStockV1;
import com.festivalplatform.domain.webhooks.event.payload.OrderCreatedV1;
import com.festivalplatform.domain.webhooks.event.payload.OrderPaidV1;
import com.festivalplatform.domain.webhooks.event.payload.OrderRefundedV1;
import com.festivalplatform.domain.webhooks.event.payload.TicketScannedV1;
import com.festivalplatform.domain.webhooks.event.payload.TicketTransferredV1;
import com.festivalplatform.domain.webhooks.event.payload.WalletPaymentV1;
import com.festivalplatform.domain.webhooks.event.payload.WalletTopupV1;
import java.util.Arrays;
import java.util.Optional;

/** Stable catalog of event types a webhook can subscribe to. */
public enum EventType {
  ORDER_CREATED("order.created", EventCategory.ORDER, OrderCreatedV1.class),
  ORDER_PAID("order.paid", EventCategory.ORDER, OrderPaidV1.class),
  ORDER_REFUNDED("order.refunded", EventCategory.ORDER, OrderRefundedV1.class),
  WALLET_TOPUP("wallet.topup", EventCategory.WALLET, WalletTopupV1.class),
  WALLET_PAYMENT("wallet.payment", EventCategory.WALLET, WalletPaymentV1.class),
  TICKET_SCANNED("ticket.scanned", EventCategory.TICKET, TicketScannedV1.class),
  TICKET_TRANSFERRED("ticket.transferred", EventCategory.TICKET, TicketTransferredV1.class),
  INVENTORY_LOW_STOCK("inventory.low_stock", EventCategory.INVENTORY, InventoryLowStockV1.class);

  private final String wireName;
  private final EventCategory category;
  private final Class<?> payloadType;

  EventType(String wireName, EventCategory category, Class<?> payloadType) {
    this.wireName = wireName;
    this.category = category;
    this.payloadType = payloadType;
  }

  public String wireName() {
    return wireName;
  }

  public EventCategory category() {
    return category;
  }

  public Class<?> payloadType() {
    return payloadType;
  }

  public static Optional<EventType> fromWireName(String wireName) {
    if (wireName == null || wireName.isBlank()) {
      return Optional.empty();
    }
    String candidate = wireName.trim();
    return Arrays.stream(values()).filter(type -> type.wireName.equals(candidate)).findFirst();
  }

  public static EventType requireWireName(String wireName) {
    return fromWireName(wireName)
        .orElseThrow(() -> new IllegalArgumentException("Invalid event type: " + wireName));
  }

  @Override
  public String toString() {
    return wireName;
  }
}
