package com.festivalplatform.integration.webhookhttp;

import java.io.ByteArrayOutputStream;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Flow;

/** Reads at most {@code maxBytes} of a response body and cancels the stream past that. */
final class BoundedBodyHandler implements HttpResponse.BodyHandler<String> {
  private final int maxBytes;

  BoundedBodyHandler(int maxBytes) {
    if (maxBytes < 1) {
      throw new IllegalArgumentException("maxBytes must be >= 1");
    }
    this.maxBytes = maxBytes;
  }

  @Override
  public HttpResponse.BodySubscriber<String> apply(HttpResponse.ResponseInfo responseInfo) {
    return new BoundedSubscriber(maxBytes);
  }

  static final class BoundedSubscriber implements HttpResponse.BodySubscriber<String> {
    private final int maxBytes;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final CompletableFuture<String> body = new CompletableFuture<>();
    private Flow.Subscription subscription;

    BoundedSubscriber(int maxBytes) {
      this.maxBytes = maxBytes;
    }

    @Override
    public CompletionStage<String> getBody() {
      return body;
    }

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
      this.subscription = subscription;
      subscription.request(Long.MAX_VALUE);
    }

    @Override
    public void onNext(List<ByteBuffer> items) {
      if (body.isDone()) {
        return;
      }
      boolean truncated = false;
      for (ByteBuffer item : items) {
        int capacity = maxBytes - buffer.size();
        int length = Math.min(capacity, item.remaining());
        if (length > 0) {
          byte[] chunk = new byte[length];
          item.get(chunk);
          buffer.write(chunk, 0, length);
        }
        if (item.hasRemaining()) {
          truncated = true;
          break;
        }
      }
      if (truncated) {
        subscription.cancel();
        complete();
      }
    }

    @Override
    public void onError(Throwable throwable) {
      body.completeExceptionally(throwable);
    }

    @Override
    public void onComplete() {
      complete();
    }

    private void complete() {
      body.complete(new String(buffer.toByteArray(), StandardCharsets.UTF_8));
    }
  }
}
