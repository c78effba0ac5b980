package com.festivalplatform.infra.queue.kafka;

public final class DeliveryTaskHeaders {
  public static final String X_TASK_REASON = "x-task-reason";
  public static final String CONTENT_TYPE = "content-type";
  public static final String APPLICATION_JSON = "application/json";

  private DeliveryTaskHeaders() {}
}
