package com.festivalplatform.infra.queue.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "infra.queue")
public class InfraQueueProperties {
  public static final String MODE_KAFKA = "kafka";
  public static final String MODE_SYNCHRONOUS = "synchronous";

  private String mode = MODE_KAFKA;
  private Kafka kafka = new Kafka();
  private Scheduler scheduler = new Scheduler();

  public String getMode() {
    return mode;
  }

  public void setMode(String mode) {
    this.mode = mode;
  }

  public Kafka getKafka() {
    return kafka;
  }

  public void setKafka(Kafka kafka) {
    this.kafka = kafka;
  }

  public Scheduler getScheduler() {
    return scheduler;
  }

  public void setScheduler(Scheduler scheduler) {
    this.scheduler = scheduler;
  }

  public boolean isSynchronous() {
    return MODE_SYNCHRONOUS.equalsIgnoreCase(mode);
  }

  public static class Kafka {
    private List<String> bootstrapServers = new ArrayList<>(List.of("localhost:9092"));
    private String topic = "webhooks.delivery.v1";
    private String clientId = "webhook-service-producer";
    private String consumerGroupId = "cg-webhook-delivery";
    private String autoOffsetReset = "earliest";
    private int concurrency = 3;
    private int partitions = 6;
    private int replicationFactor = 1;
    private boolean createTopic = true;
    private long sendTimeoutMs = 5000L;
    private int maxPollRecords = 50;
    // A poll batch may contain several sends at the per-webhook timeout ceiling.
    private int maxPollIntervalMs = 600000;

    public List<String> getBootstrapServers() {
      return bootstrapServers;
    }

    public void setBootstrapServers(List<String> bootstrapServers) {
      this.bootstrapServers = bootstrapServers;
    }

    public String getTopic() {
      return topic;
    }

    public void setTopic(String topic) {
      this.topic = topic;
    }

    public String getClientId() {
      return clientId;
    }

    public void setClientId(String clientId) {
      this.clientId = clientId;
    }

    public String getConsumerGroupId() {
      return consumerGroupId;
    }

    public void setConsumerGroupId(String consumerGroupId) {
      this.consumerGroupId = consumerGroupId;
    }

    public String getAutoOffsetReset() {
      return autoOffsetReset;
    }

    public void setAutoOffsetReset(String autoOffsetReset) {
      this.autoOffsetReset = autoOffsetReset;
    }

    public int getConcurrency() {
      return concurrency;
    }

    public void setConcurrency(int concurrency) {
      this.concurrency = concurrency;
    }

    public int getPartitions() {
      return partitions;
    }

    public void setPartitions(int partitions) {
      this.partitions = partitions;
    }

    public int getReplicationFactor() {
      return replicationFactor;
    }

    public void setReplicationFactor(int replicationFactor) {
      this.replicationFactor = replicationFactor;
    }

    public boolean isCreateTopic() {
      return createTopic;
    }

    public void setCreateTopic(boolean createTopic) {
      this.createTopic = createTopic;
    }

    public long getSendTimeoutMs() {
      return sendTimeoutMs;
    }

    public void setSendTimeoutMs(long sendTimeoutMs) {
      this.sendTimeoutMs = sendTimeoutMs;
    }

    public int getMaxPollRecords() {
      return maxPollRecords;
    }

    public void setMaxPollRecords(int maxPollRecords) {
      this.maxPollRecords = maxPollRecords;
    }

    public int getMaxPollIntervalMs() {
      return maxPollIntervalMs;
    }

    public void setMaxPollIntervalMs(int maxPollIntervalMs) {
      this.maxPollIntervalMs = maxPollIntervalMs;
    }

    public String bootstrapServersAsCsv() {
      return String.join(",", bootstrapServers);
    }
  }

  public static class Scheduler {
    private int poolSize = 2;
    private String threadNamePrefix = "webhook-retry-";

    public int getPoolSize() {
      return poolSize;
    }

    public void setPoolSize(int poolSize) {
      this.poolSize = poolSize;
    }

    public String getThreadNamePrefix() {
      return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
      this.threadNamePrefix = threadNamePrefix;
    }
  }
}
