package com.festivalplatform.integration.webhookhttp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.Flow;
import org.junit.jupiter.api.Test;

class BoundedBodyHandlerTest {
  @Test
  void shouldTruncateAndCancelPastLimit() throws Exception {
    BoundedBodyHandler.BoundedSubscriber subscriber = new BoundedBodyHandler.BoundedSubscriber(8);
    RecordingSubscription subscription = new RecordingSubscription();

    subscriber.onSubscribe(subscription);
    subscriber.onNext(List.of(bytes("hello "), bytes("world")));
    subscriber.onNext(List.of(bytes("ignored")));

    assertEquals("hello wo", subscriber.getBody().toCompletableFuture().get());
    assertTrue(subscription.cancelled);
  }

  @Test
  void shouldReturnWholeBodyUnderLimit() throws Exception {
    BoundedBodyHandler.BoundedSubscriber subscriber = new BoundedBodyHandler.BoundedSubscriber(64);
    RecordingSubscription subscription = new RecordingSubscription();

    subscriber.onSubscribe(subscription);
    subscriber.onNext(List.of(bytes("{\"ok\":true}")));
    subscriber.onComplete();

    assertEquals("{\"ok\":true}", subscriber.getBody().toCompletableFuture().get());
    assertFalse(subscription.cancelled);
  }

  private static ByteBuffer bytes(String value) {
    return ByteBuffer.wrap(value.getBytes(StandardCharsets.UTF_8));
  }

  private static final class RecordingSubscription implements Flow.Subscription {
    private boolean cancelled;

    @Override
    public void request(long n) {}

    @Override
    public void cancel() {
      cancelled = true;
    }
  }
}
