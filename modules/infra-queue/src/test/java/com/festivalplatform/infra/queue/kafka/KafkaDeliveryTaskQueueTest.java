package com.festivalplatform.infra.queue.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.festivalplatform.infra.queue.DeliveryQueueException;
import com.festivalplatform.infra.queue.DeliveryTask;
import com.festivalplatform.infra.queue.observability.NoOpQueueTelemetry;
import com.festivalplatform.infra.queue.serde.DeliveryTaskJsonCodec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.TaskScheduler;

class KafkaDeliveryTaskQueueTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final String TOPIC = "webhooks.delivery.v1";

  private KafkaTemplate<String, String> kafkaTemplate;
  private TaskScheduler taskScheduler;
  private DeliveryTaskJsonCodec codec;
  private KafkaDeliveryTaskQueue queue;

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() {
    kafkaTemplate = mock(KafkaTemplate.class);
    taskScheduler = mock(TaskScheduler.class);
    codec = new DeliveryTaskJsonCodec();
    queue =
        new KafkaDeliveryTaskQueue(
            kafkaTemplate,
            codec,
            new NoOpQueueTelemetry(),
            taskScheduler,
            TOPIC,
            Duration.ofSeconds(1),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  @SuppressWarnings("unchecked")
  void shouldPublishKeyedByDeliveryId() {
    UUID deliveryId = UUID.randomUUID();
    when(kafkaTemplate.send(any(ProducerRecord.class)))
        .thenReturn(
            CompletableFuture.completedFuture(
                new SendResult<>(new ProducerRecord<>(TOPIC, deliveryId.toString(), "{}"), null)));

    queue.enqueue(DeliveryTask.of(deliveryId, DeliveryTask.Reason.DISPATCH, NOW));

    ArgumentCaptor<ProducerRecord<String, String>> captor =
        ArgumentCaptor.forClass(ProducerRecord.class);
    verify(kafkaTemplate).send(captor.capture());
    ProducerRecord<String, String> record = captor.getValue();
    assertEquals(TOPIC, record.topic());
    assertEquals(deliveryId.toString(), record.key());
    assertEquals(deliveryId, codec.decode(record.value()).deliveryId());
    Header reason = record.headers().lastHeader(DeliveryTaskHeaders.X_TASK_REASON);
    assertEquals("DISPATCH", new String(reason.value(), StandardCharsets.UTF_8));
  }

  @Test
  @SuppressWarnings("unchecked")
  void shouldWrapBrokerFailure() {
    UUID deliveryId = UUID.randomUUID();
    when(kafkaTemplate.send(any(ProducerRecord.class)))
        .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

    DeliveryQueueException ex =
        assertThrows(
            DeliveryQueueException.class,
            () -> queue.enqueue(DeliveryTask.of(deliveryId, DeliveryTask.Reason.DISPATCH, NOW)));

    assertEquals(deliveryId, ex.getDeliveryId());
    assertEquals("broker down", ex.getCause().getMessage());
  }

  @Test
  @SuppressWarnings("unchecked")
  void shouldScheduleFutureTasksWithoutPublishingYet() {
    Instant processAt = NOW.plusSeconds(20);

    queue.enqueueAt(
        DeliveryTask.of(UUID.randomUUID(), DeliveryTask.Reason.RETRY, NOW), processAt);

    verify(taskScheduler).schedule(any(Runnable.class), eq(processAt));
    verify(kafkaTemplate, never()).send(any(ProducerRecord.class));
  }

  @Test
  @SuppressWarnings("unchecked")
  void shouldPublishImmediatelyWhenAlreadyDue() {
    when(kafkaTemplate.send(any(ProducerRecord.class)))
        .thenReturn(
            CompletableFuture.completedFuture(
                new SendResult<>(new ProducerRecord<>(TOPIC, "k", "{}"), null)));

    queue.enqueueAt(
        DeliveryTask.of(UUID.randomUUID(), DeliveryTask.Reason.RETRY, NOW), NOW.minusSeconds(1));

    verify(kafkaTemplate).send(any(ProducerRecord.class));
    verify(taskScheduler, never()).schedule(any(Runnable.class), any(Instant.class));
  }
}
