package com.festivalplatform.infra.queue.kafka;

import com.festivalplatform.infra.queue.DeliveryQueueException;
import com.festivalplatform.infra.queue.DeliveryTask;
import com.festivalplatform.infra.queue.DeliveryTaskQueue;
import com.festivalplatform.infra.queue.observability.QueueTelemetry;
import com.festivalplatform.infra.queue.serde.DeliveryTaskJsonCodec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.TaskScheduler;

/**
 * Publishes delivery tasks keyed by delivery id, so every task for one delivery lands on the same
 * partition and is consumed by a single listener thread. Delayed tasks are held by an in-process
 * scheduler until due; tasks lost on restart are recovered by the retry sweep.
 */
public class KafkaDeliveryTaskQueue implements DeliveryTaskQueue {
  static final String QUEUE_NAME = "kafka";

  private static final Logger log = LoggerFactory.getLogger(KafkaDeliveryTaskQueue.class);

  private final KafkaTemplate<String, String> kafkaTemplate;
  private final DeliveryTaskJsonCodec codec;
  private final QueueTelemetry telemetry;
  private final TaskScheduler taskScheduler;
  private final String topic;
  private final Duration sendTimeout;
  private final Clock clock;

  public KafkaDeliveryTaskQueue(
      KafkaTemplate<String, String> kafkaTemplate,
      DeliveryTaskJsonCodec codec,
      QueueTelemetry telemetry,
      TaskScheduler taskScheduler,
      String topic,
      Duration sendTimeout,
      Clock clock) {
    this.kafkaTemplate = Objects.requireNonNull(kafkaTemplate, "kafkaTemplate must not be null");
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    this.taskScheduler = Objects.requireNonNull(taskScheduler, "taskScheduler must not be null");
    if (topic == null || topic.isBlank()) {
      throw new IllegalArgumentException("topic must not be blank");
    }
    this.topic = topic;
    this.sendTimeout = sendTimeout == null ? Duration.ZERO : sendTimeout;
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  @Override
  public void enqueue(DeliveryTask task) {
    Objects.requireNonNull(task, "task must not be null");
    publish(task, false);
  }

  @Override
  public void enqueueAt(DeliveryTask task, Instant processAt) {
    Objects.requireNonNull(task, "task must not be null");
    if (processAt == null || !processAt.isAfter(clock.instant())) {
      enqueue(task);
      return;
    }
    taskScheduler.schedule(() -> publishScheduled(task), processAt);
    log.debug(
        "Scheduled delayed delivery task delivery_id={} process_at={}",
        task.deliveryId(),
        processAt);
  }

  private void publishScheduled(DeliveryTask task) {
    try {
      publish(task, true);
    } catch (DeliveryQueueException ex) {
      log.error(
          "Delayed delivery task publish failed, retry sweep will recover delivery_id={} error={}",
          task.deliveryId(),
          ex.getMessage());
    }
  }

  private void publish(DeliveryTask task, boolean delayed) {
    String key = task.deliveryId().toString();
    String reason = task.reason().name();
    ProducerRecord<String, String> record = new ProducerRecord<>(topic, key, codec.encode(task));
    record.headers().add(DeliveryTaskHeaders.X_TASK_REASON, reason.getBytes(StandardCharsets.UTF_8));
    record
        .headers()
        .add(
            DeliveryTaskHeaders.CONTENT_TYPE,
            DeliveryTaskHeaders.APPLICATION_JSON.getBytes(StandardCharsets.UTF_8));

    try {
      CompletableFuture<SendResult<String, String>> sendFuture = kafkaTemplate.send(record);
      if (sendTimeout.isZero() || sendTimeout.isNegative()) {
        sendFuture.get();
      } else {
        sendFuture.get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
      }
      telemetry.onEnqueue(QUEUE_NAME, reason, delayed);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw failure(task, "Interrupted publishing delivery task", ex);
    } catch (TimeoutException ex) {
      throw failure(task, "Timed out publishing delivery task", ex);
    } catch (ExecutionException ex) {
      throw failure(
          task, "Failed to publish delivery task", ex.getCause() == null ? ex : ex.getCause());
    } catch (RuntimeException ex) {
      throw failure(task, "Failed to publish delivery task", ex);
    }
  }

  private DeliveryQueueException failure(DeliveryTask task, String message, Throwable cause) {
    telemetry.onEnqueueFailure(QUEUE_NAME, task.reason().name(), cause);
    return new DeliveryQueueException(
        task.deliveryId(),
        message + " topic=" + topic + " delivery_id=" + task.deliveryId(),
        cause);
  }
}
