package com.festivalplatform.infra.queue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.festivalplatform.infra.queue.observability.NoOpQueueTelemetry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class SynchronousDeliveryTaskQueueTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Test
  void shouldProcessTaskInlineOnEnqueue() {
    List<DeliveryTask> handled = new ArrayList<>();
    SynchronousDeliveryTaskQueue queue =
        new SynchronousDeliveryTaskQueue(() -> handled::add, new NoOpQueueTelemetry());
    DeliveryTask task = DeliveryTask.of(UUID.randomUUID(), DeliveryTask.Reason.DISPATCH, NOW);

    queue.enqueue(task);

    assertEquals(List.of(task), handled);
  }

  @Test
  void shouldLeaveDelayedTasksToSweep() {
    List<DeliveryTask> handled = new ArrayList<>();
    SynchronousDeliveryTaskQueue queue =
        new SynchronousDeliveryTaskQueue(() -> handled::add, new NoOpQueueTelemetry());

    queue.enqueueAt(
        DeliveryTask.of(UUID.randomUUID(), DeliveryTask.Reason.RETRY, NOW), NOW.plusSeconds(10));

    assertTrue(handled.isEmpty());
  }

  @Test
  void shouldWrapHandlerFailure() {
    UUID deliveryId = UUID.randomUUID();
    SynchronousDeliveryTaskQueue queue =
        new SynchronousDeliveryTaskQueue(
            () ->
                task -> {
                  throw new IllegalStateException("db down");
                },
            new NoOpQueueTelemetry());

    DeliveryQueueException ex =
        assertThrows(
            DeliveryQueueException.class,
            () -> queue.enqueue(DeliveryTask.of(deliveryId, DeliveryTask.Reason.DISPATCH, NOW)));

    assertEquals(deliveryId, ex.getDeliveryId());
    assertEquals("db down", ex.getCause().getMessage());
  }
}
