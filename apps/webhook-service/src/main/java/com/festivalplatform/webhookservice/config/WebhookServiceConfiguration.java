package com.festivalplatform.webhookservice.config;

import com.festivalplatform.domain.webhooks.delivery.DeliveryBackoff;
import com.festivalplatform.domain.webhooks.event.EventPayloadCodec;
import com.festivalplatform.integration.webhookhttp.HttpWebhookSender;
import com.festivalplatform.integration.webhookhttp.WebhookSender;
import com.festivalplatform.integration.webhookhttp.WebhookSenderConfig;
import com.festivalplatform.integration.webhookhttp.WebhookUrlValidator;
import com.festivalplatform.webhookservice.observability.DeliveryTelemetry;
import com.festivalplatform.webhookservice.observability.MicrometerDeliveryTelemetry;
import com.festivalplatform.webhookservice.observability.NoOpDeliveryTelemetry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class WebhookServiceConfiguration {
  private static final Logger log = LoggerFactory.getLogger(WebhookServiceConfiguration.class);

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public EventPayloadCodec eventPayloadCodec() {
    return new EventPayloadCodec();
  }

  @Bean
  public DeliveryBackoff deliveryBackoff(WebhookServiceProperties properties) {
    WebhookServiceProperties.Retry retry = properties.getRetry();
    return new DeliveryBackoff(
        retry.getBaseDelay(), retry.getMultiplier(), retry.getMaxDelay(), retry.getJitterRatio());
  }

  @Bean
  public WebhookUrlValidator webhookUrlValidator(WebhookServiceProperties properties) {
    boolean allowInsecure = properties.getSender().isAllowInsecure();
    if (allowInsecure) {
      log.warn("Webhook sender running in insecure mode: http and private targets are allowed");
    }
    return new WebhookUrlValidator(allowInsecure);
  }

  @Bean
  public WebhookSenderConfig webhookSenderConfig(WebhookServiceProperties properties) {
    WebhookServiceProperties.Sender sender = properties.getSender();
    return new WebhookSenderConfig(
        sender.getUserAgent(),
        sender.getResponseBodyLimitBytes(),
        sender.getConnectTimeout(),
        Duration.ofSeconds(properties.getDefaultTimeoutSeconds()));
  }

  @Bean
  public WebhookSender webhookSender(
      WebhookSenderConfig webhookSenderConfig, WebhookUrlValidator webhookUrlValidator) {
    return new HttpWebhookSender(webhookSenderConfig, webhookUrlValidator);
  }

  @Bean
  public DeliveryTelemetry deliveryTelemetry(ObjectProvider<MeterRegistry> meterRegistry) {
    MeterRegistry registry = meterRegistry.getIfAvailable();
    return registry == null ? new NoOpDeliveryTelemetry() : new MicrometerDeliveryTelemetry(registry);
  }
}
