package com.festivalplatform.infra.queue.observability;

public class NoOpQueueTelemetry implements QueueTelemetry {
  @Override
  public void onEnqueue(String queue, String reason, boolean delayed) {}

  @Override
  public void onEnqueueFailure(String queue, String reason, Throwable error) {}

  @Override
  public void onTaskProcessed(String queue, long durationNanos) {}

  @Override
  public void onTaskFailed(String queue, Throwable error) {}
}
