package com.festivalplatform.infra.queue;

import com.festivalplatform.infra.queue.observability.QueueTelemetry;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs tasks inline on the caller thread. Delayed tasks are dropped and left to the retry sweep,
 * which makes this suitable for tests and single-node deployments only.
 */
public class SynchronousDeliveryTaskQueue implements DeliveryTaskQueue {
  static final String QUEUE_NAME = "synchronous";

  private static final Logger log = LoggerFactory.getLogger(SynchronousDeliveryTaskQueue.class);

  private final Supplier<DeliveryTaskHandler> handlerSupplier;
  private final QueueTelemetry telemetry;

  public SynchronousDeliveryTaskQueue(
      Supplier<DeliveryTaskHandler> handlerSupplier, QueueTelemetry telemetry) {
    this.handlerSupplier =
        Objects.requireNonNull(handlerSupplier, "handlerSupplier must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
  }

  @Override
  public void enqueue(DeliveryTask task) {
    Objects.requireNonNull(task, "task must not be null");
    telemetry.onEnqueue(QUEUE_NAME, task.reason().name(), false);
    long started = System.nanoTime();
    try {
      handlerSupplier.get().handle(task);
      telemetry.onTaskProcessed(QUEUE_NAME, System.nanoTime() - started);
    } catch (RuntimeException ex) {
      telemetry.onTaskFailed(QUEUE_NAME, ex);
      throw new DeliveryQueueException(
          task.deliveryId(), "Inline delivery processing failed for " + task.deliveryId(), ex);
    }
  }

  @Override
  public void enqueueAt(DeliveryTask task, Instant processAt) {
    Objects.requireNonNull(task, "task must not be null");
    log.debug(
        "Delayed enqueue not supported inline, leaving to sweep delivery_id={} process_at={}",
        task.deliveryId(),
        processAt);
  }
}
