package com.festivalplatform.infra.queue;

@FunctionalInterface
public interface DeliveryTaskHandler {
  void handle(DeliveryTask task);
}
