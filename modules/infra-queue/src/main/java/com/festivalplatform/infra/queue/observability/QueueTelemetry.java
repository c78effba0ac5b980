package com.festivalplatform.infra.queue.observability;

public interface QueueTelemetry {
  void onEnqueue(String queue, String reason, boolean delayed);

  void onEnqueueFailure(String queue, String reason, Throwable error);

  void onTaskProcessed(String queue, long durationNanos);

  void onTaskFailed(String queue, Throwable error);
}
