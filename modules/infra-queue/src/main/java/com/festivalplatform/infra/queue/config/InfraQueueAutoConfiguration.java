package com.festivalplatform.infra.queue.config;

import com.festivalplatform.infra.queue.DeliveryTaskHandler;
import com.festivalplatform.infra.queue.DeliveryTaskQueue;
import com.festivalplatform.infra.queue.SynchronousDeliveryTaskQueue;
import com.festivalplatform.infra.queue.kafka.DeliveryTaskConsumerAdapter;
import com.festivalplatform.infra.queue.kafka.KafkaDeliveryTaskQueue;
import com.festivalplatform.infra.queue.observability.MicrometerQueueTelemetry;
import com.festivalplatform.infra.queue.observability.NoOpQueueTelemetry;
import com.festivalplatform.infra.queue.observability.QueueTelemetry;
import com.festivalplatform.infra.queue.serde.DeliveryTaskJsonCodec;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@AutoConfiguration
@EnableConfigurationProperties(InfraQueueProperties.class)
public class InfraQueueAutoConfiguration {
  @Bean
  @ConditionalOnMissingBean
  public DeliveryTaskJsonCodec deliveryTaskJsonCodec() {
    return new DeliveryTaskJsonCodec();
  }

  @Bean
  @ConditionalOnClass(MeterRegistry.class)
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(QueueTelemetry.class)
  public QueueTelemetry micrometerQueueTelemetry(MeterRegistry meterRegistry) {
    return new MicrometerQueueTelemetry(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(QueueTelemetry.class)
  public QueueTelemetry noOpQueueTelemetry() {
    return new NoOpQueueTelemetry();
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(prefix = "infra.queue", name = "mode", havingValue = "synchronous")
  static class SynchronousQueueConfiguration {
    @Bean
    @ConditionalOnMissingBean(DeliveryTaskQueue.class)
    public DeliveryTaskQueue synchronousDeliveryTaskQueue(
        ObjectProvider<DeliveryTaskHandler> deliveryTaskHandler, QueueTelemetry queueTelemetry) {
      return new SynchronousDeliveryTaskQueue(deliveryTaskHandler::getObject, queueTelemetry);
    }
  }

  @Configuration(proxyBeanMethods = false)
  @EnableKafka
  @ConditionalOnProperty(
      prefix = "infra.queue",
      name = "mode",
      havingValue = "kafka",
      matchIfMissing = true)
  static class KafkaQueueConfiguration {
    @Bean
    @ConditionalOnMissingBean(name = "infraQueueProducerFactory")
    public ProducerFactory<String, String> infraQueueProducerFactory(
        InfraQueueProperties properties) {
      InfraQueueProperties.Kafka kafka = properties.getKafka();

      Map<String, Object> config = new HashMap<>();
      config.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.bootstrapServersAsCsv());
      config.put(ProducerConfig.CLIENT_ID_CONFIG, kafka.getClientId());
      config.put(ProducerConfig.ACKS_CONFIG, "all");
      config.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
      config.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 5);
      config.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
      config.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
      return new DefaultKafkaProducerFactory<>(config);
    }

    @Bean
    @ConditionalOnMissingBean(name = "infraQueueKafkaTemplate")
    public KafkaTemplate<String, String> infraQueueKafkaTemplate(
        @Qualifier("infraQueueProducerFactory")
            ProducerFactory<String, String> infraQueueProducerFactory) {
      return new KafkaTemplate<>(infraQueueProducerFactory);
    }

    @Bean
    @ConditionalOnProperty(
        prefix = "infra.queue.kafka",
        name = "create-topic",
        havingValue = "true",
        matchIfMissing = true)
    @ConditionalOnMissingBean(name = "infraQueueTopics")
    public KafkaAdmin.NewTopics infraQueueTopics(InfraQueueProperties properties) {
      InfraQueueProperties.Kafka kafka = properties.getKafka();
      NewTopic topic =
          new NewTopic(
              kafka.getTopic(),
              Math.max(1, kafka.getPartitions()),
              (short) Math.max(1, kafka.getReplicationFactor()));
      return new KafkaAdmin.NewTopics(topic);
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "deliveryRetryTaskScheduler")
    public ThreadPoolTaskScheduler deliveryRetryTaskScheduler(InfraQueueProperties properties) {
      ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
      scheduler.setPoolSize(Math.max(1, properties.getScheduler().getPoolSize()));
      scheduler.setThreadNamePrefix(properties.getScheduler().getThreadNamePrefix());
      scheduler.setRemoveOnCancelPolicy(true);
      scheduler.initialize();
      return scheduler;
    }

    @Bean
    @ConditionalOnMissingBean(DeliveryTaskQueue.class)
    public DeliveryTaskQueue kafkaDeliveryTaskQueue(
        @Qualifier("infraQueueKafkaTemplate") KafkaTemplate<String, String> infraQueueKafkaTemplate,
        DeliveryTaskJsonCodec deliveryTaskJsonCodec,
        QueueTelemetry queueTelemetry,
        @Qualifier("deliveryRetryTaskScheduler") ThreadPoolTaskScheduler deliveryRetryTaskScheduler,
        InfraQueueProperties properties,
        ObjectProvider<Clock> clock) {
      InfraQueueProperties.Kafka kafka = properties.getKafka();
      return new KafkaDeliveryTaskQueue(
          infraQueueKafkaTemplate,
          deliveryTaskJsonCodec,
          queueTelemetry,
          deliveryRetryTaskScheduler,
          kafka.getTopic(),
          Duration.ofMillis(Math.max(0L, kafka.getSendTimeoutMs())),
          clock.getIfAvailable(Clock::systemUTC));
    }

    @Bean
    @ConditionalOnBean(DeliveryTaskHandler.class)
    @ConditionalOnMissingBean
    public DeliveryTaskConsumerAdapter deliveryTaskConsumerAdapter(
        DeliveryTaskJsonCodec deliveryTaskJsonCodec,
        DeliveryTaskHandler deliveryTaskHandler,
        QueueTelemetry queueTelemetry) {
      return new DeliveryTaskConsumerAdapter(
          deliveryTaskJsonCodec, deliveryTaskHandler, queueTelemetry);
    }

    @Bean
    @ConditionalOnMissingBean(name = "infraQueueConsumerFactory")
    public ConsumerFactory<String, String> infraQueueConsumerFactory(
        InfraQueueProperties properties) {
      InfraQueueProperties.Kafka kafka = properties.getKafka();

      Map<String, Object> config = new HashMap<>();
      config.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.bootstrapServersAsCsv());
      config.put(ConsumerConfig.GROUP_ID_CONFIG, kafka.getConsumerGroupId());
      config.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, kafka.getAutoOffsetReset());
      config.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
      config.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, Math.max(1, kafka.getMaxPollRecords()));
      config.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, kafka.getMaxPollIntervalMs());
      config.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
      config.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
      return new DefaultKafkaConsumerFactory<>(config);
    }

    @Bean(name = "infraQueueListenerContainerFactory")
    @ConditionalOnMissingBean(name = "infraQueueListenerContainerFactory")
    public ConcurrentKafkaListenerContainerFactory<String, String>
        infraQueueListenerContainerFactory(
            @Qualifier("infraQueueConsumerFactory")
                ConsumerFactory<String, String> infraQueueConsumerFactory,
            InfraQueueProperties properties) {
      ConcurrentKafkaListenerContainerFactory<String, String> factory =
          new ConcurrentKafkaListenerContainerFactory<>();
      factory.setConsumerFactory(infraQueueConsumerFactory);
      factory.setConcurrency(Math.max(1, properties.getKafka().getConcurrency()));
      factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL_IMMEDIATE);
      return factory;
    }
  }
}
