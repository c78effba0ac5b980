package com.festivalplatform.domain.webhooks.event;

public enum EventCategory {
  ORDER("order"),
  WALLET("wallet"),
  TICKET("ticket"),
  INVENTORY("inventory");

  private final String wireName;

  EventCategory(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }
}
