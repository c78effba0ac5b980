package com.festivalplatform.infra.queue;

import java.time.Instant;

/**
 * Schedules delivery processing. Implementations must never hand the same delivery id to two
 * workers at once.
 */
public interface DeliveryTaskQueue {
  /**
   * @throws DeliveryQueueException if the task could not be handed to the queue
   */
  void enqueue(DeliveryTask task);

  /** Runs {@code task} no earlier than {@code processAt}. */
  void enqueueAt(DeliveryTask task, Instant processAt);
}
