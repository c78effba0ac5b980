package com.festivalplatform.webhookservice.dispatch;

import com.festivalplatform.infra.queue.kafka.DeliveryTaskConsumerAdapter;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    prefix = "infra.queue",
    name = "mode",
    havingValue = "kafka",
    matchIfMissing = true)
public class DeliveryTaskListener {
  private final DeliveryTaskConsumerAdapter adapter;

  public DeliveryTaskListener(DeliveryTaskConsumerAdapter adapter) {
    this.adapter = adapter;
  }

  // Failed tasks are acknowledged too; the row stays non-terminal and the sweeps re-enqueue it.
  @KafkaListener(
      topics = "${infra.queue.kafka.topic:webhooks.delivery.v1}",
      groupId = "${infra.queue.kafka.consumer-group-id:cg-webhook-delivery}",
      containerFactory = "infraQueueListenerContainerFactory")
  public void onMessage(ConsumerRecord<String, String> record, Acknowledgment ack) {
    adapter.process(record);
    ack.acknowledge();
  }
}
