package com.festivalplatform.infra.queue.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;

public class MicrometerQueueTelemetry implements QueueTelemetry {
  private final MeterRegistry meterRegistry;

  public MicrometerQueueTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onEnqueue(String queue, String reason, boolean delayed) {
    Counter.builder("infra.queue.enqueue.total")
        .description("Delivery tasks handed to the queue by outcome")
        .tag("queue", safeValue(queue))
        .tag("reason", safeValue(reason))
        .tag("delayed", Boolean.toString(delayed))
        .tag("outcome", "success")
        .tag("error", "none")
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onEnqueueFailure(String queue, String reason, Throwable error) {
    Counter.builder("infra.queue.enqueue.total")
        .description("Delivery tasks handed to the queue by outcome")
        .tag("queue", safeValue(queue))
        .tag("reason", safeValue(reason))
        .tag("delayed", "unknown")
        .tag("outcome", "failure")
        .tag("error", safeError(error))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onTaskProcessed(String queue, long durationNanos) {
    Counter.builder("infra.queue.task.total")
        .description("Delivery tasks processed by outcome")
        .tag("queue", safeValue(queue))
        .tag("outcome", "success")
        .tag("error", "none")
        .register(meterRegistry)
        .increment();

    Timer.builder("infra.queue.task.duration")
        .description("Delivery task processing latency")
        .tag("queue", safeValue(queue))
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onTaskFailed(String queue, Throwable error) {
    Counter.builder("infra.queue.task.total")
        .description("Delivery tasks processed by outcome")
        .tag("queue", safeValue(queue))
        .tag("outcome", "failure")
        .tag("error", safeError(error))
        .register(meterRegistry)
        .increment();
  }

  private static String safeValue(String value) {
    if (value == null || value.isBlank()) {
      return "unknown";
    }
    return value;
  }

  private static String safeError(Throwable error) {
    if (error == null) {
      return "none";
    }
    return error.getClass().getSimpleName();
  }
}
