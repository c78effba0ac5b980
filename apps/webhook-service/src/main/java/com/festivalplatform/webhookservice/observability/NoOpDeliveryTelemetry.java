package com.festivalplatform.webhookservice.observability;

public class NoOpDeliveryTelemetry implements DeliveryTelemetry {
  @Override
  public void onAttempt(String eventType, String outcome, long durationMillis) {}

  @Override
  public void onDeliveryOutcome(String eventType, String outcome) {}

  @Override
  public void onDeliveriesCreated(String eventType, int count) {}
}
