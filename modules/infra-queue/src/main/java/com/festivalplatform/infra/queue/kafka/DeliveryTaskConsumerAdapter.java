package com.festivalplatform.infra.queue.kafka;

import com.festivalplatform.infra.queue.DeliveryTask;
import com.festivalplatform.infra.queue.DeliveryTaskHandler;
import com.festivalplatform.infra.queue.observability.QueueTelemetry;
import com.festivalplatform.infra.queue.serde.DeliveryTaskJsonCodec;
import java.util.Objects;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes a delivery task record and hands it to the handler. Failures are logged and swallowed
 * at this boundary: the delivery row stays non-terminal and the periodic sweeps pick it up again.
 */
public class DeliveryTaskConsumerAdapter {
  private static final Logger log = LoggerFactory.getLogger(DeliveryTaskConsumerAdapter.class);

  private final DeliveryTaskJsonCodec codec;
  private final DeliveryTaskHandler handler;
  private final QueueTelemetry telemetry;

  public DeliveryTaskConsumerAdapter(
      DeliveryTaskJsonCodec codec, DeliveryTaskHandler handler, QueueTelemetry telemetry) {
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
    this.handler = Objects.requireNonNull(handler, "handler must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
  }

  /** Returns true when the handler completed without throwing. */
  public boolean process(ConsumerRecord<String, String> record) {
    long started = System.nanoTime();
    DeliveryTask task;
    try {
      task = codec.decode(record.value());
    } catch (RuntimeException ex) {
      telemetry.onTaskFailed(KafkaDeliveryTaskQueue.QUEUE_NAME, ex);
      log.error(
          "Dropping undecodable delivery task topic={} partition={} offset={} key={} error={}",
          record.topic(),
          record.partition(),
          record.offset(),
          record.key(),
          ex.getMessage());
      return false;
    }

    if (record.key() != null && !record.key().equals(task.deliveryId().toString())) {
      log.warn(
          "Delivery task key mismatch key={} delivery_id={}", record.key(), task.deliveryId());
    }

    try {
      handler.handle(task);
      telemetry.onTaskProcessed(KafkaDeliveryTaskQueue.QUEUE_NAME, System.nanoTime() - started);
      return true;
    } catch (RuntimeException ex) {
      telemetry.onTaskFailed(KafkaDeliveryTaskQueue.QUEUE_NAME, ex);
      log.error(
          "Delivery task processing failed delivery_id={} reason={} error={}",
          task.deliveryId(),
          task.reason(),
          ex.getMessage(),
          ex);
      return false;
    }
  }
}
