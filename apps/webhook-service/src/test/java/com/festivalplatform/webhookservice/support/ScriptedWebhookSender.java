package com.festivalplatform.webhookservice.support;

import com.festivalplatform.domain.webhooks.delivery.WebhookDelivery;
import com.festivalplatform.integration.webhookhttp.SendResult;
import com.festivalplatform.integration.webhookhttp.WebhookSender;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/** Returns queued results in order; the last result repeats once the script runs out. */
public class ScriptedWebhookSender implements WebhookSender {
  private final Deque<SendResult> script = new ArrayDeque<>();
  private SendResult last = SendResult.response(200, "ok", 5L);
  public final List<WebhookDelivery> sent = new ArrayList<>();
  public final List<Duration> timeouts = new ArrayList<>();

  public ScriptedWebhookSender then(SendResult result) {
    script.addLast(result);
    return this;
  }

  public ScriptedWebhookSender thenStatus(int statusCode, int times) {
    for (int i = 0; i < times; i++) {
      then(SendResult.response(statusCode, "status " + statusCode, 5L));
    }
    return this;
  }

  @Override
  public synchronized SendResult send(
      WebhookDelivery delivery, Map<String, String> customHeaders, Duration timeout) {
    sent.add(delivery);
    timeouts.add(timeout);
    if (!script.isEmpty()) {
      last = script.pollFirst();
    }
    return last;
  }

  public int calls() {
    return sent.size();
  }
}
