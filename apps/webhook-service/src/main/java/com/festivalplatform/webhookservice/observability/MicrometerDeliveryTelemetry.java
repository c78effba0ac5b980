package com.festivalplatform.webhookservice.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;

public class MicrometerDeliveryTelemetry implements DeliveryTelemetry {
  private final MeterRegistry meterRegistry;

  public MicrometerDeliveryTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onAttempt(String eventType, String outcome, long durationMillis) {
    Counter.builder("webhooks.delivery.attempts.total")
        .description("Outbound webhook HTTP attempts by outcome")
        .tag("event_type", safeValue(eventType))
        .tag("outcome", safeValue(outcome))
        .register(meterRegistry)
        .increment();

    Timer.builder("webhooks.delivery.duration")
        .description("Outbound webhook HTTP attempt latency")
        .tag("event_type", safeValue(eventType))
        .tag("outcome", safeValue(outcome))
        .register(meterRegistry)
        .record(Math.max(0L, durationMillis), TimeUnit.MILLISECONDS);
  }

  @Override
  public void onDeliveryOutcome(String eventType, String outcome) {
    Counter.builder("webhooks.delivery.outcome.total")
        .description("Webhook delivery state changes after an attempt")
        .tag("event_type", safeValue(eventType))
        .tag("outcome", safeValue(outcome))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onDeliveriesCreated(String eventType, int count) {
    if (count <= 0) {
      return;
    }
    Counter.builder("webhooks.dispatch.deliveries.created.total")
        .description("Webhook deliveries created from dispatched events")
        .tag("event_type", safeValue(eventType))
        .register(meterRegistry)
        .increment(count);
  }

  private static String safeValue(String value) {
    if (value == null || value.isBlank()) {
      return "unknown";
    }
    return value;
  }
}
