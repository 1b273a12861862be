package com.orderflow.common.kafka.config;

import com.orderflow.contracts.Topics;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "common.kafka")
public class CommonKafkaProperties {

    /**
     * Broker bootstrap address shared by the producer, the consumer and the DLQ producer.
     */
    private String bootstrapServers;

    private final Producer producer = new Producer();
    private final Consumer consumer = new Consumer();
    private final Retry retry = new Retry();
    private final Dlq dlq = new Dlq();
    private final Logging logging = new Logging();

    public String getBootstrapServers() {
        return bootstrapServers;
    }

    public void setBootstrapServers(String bootstrapServers) {
        this.bootstrapServers = bootstrapServers;
    }

    public Producer getProducer() {
        return producer;
    }

    public Consumer getConsumer() {
        return consumer;
    }

    public Retry getRetry() {
        return retry;
    }

    public Dlq getDlq() {
        return dlq;
    }

    public Logging getLogging() {
        return logging;
    }

    /**
     * Checks the settings the event producer cannot start without.
     *
     * @throws IllegalArgumentException naming the first missing or invalid setting
     */
    public void validateProducer() {
        require(hasText(bootstrapServers), "Kafka bootstrap-servers is missing from configuration.");
        require(producer.getMessageTimeoutMs() > 0, "Kafka producer message-timeout-ms must be positive.");
        require(producer.getRetryBaseDelayMs() > 0, "Kafka producer retry-base-delay-ms must be positive.");
        require(producer.getMaxRetries() > 0, "Kafka producer max-retries must be positive.");
        require(producer.getTotalPartitions() > 0, "Kafka producer total-partitions must be positive.");
        require(!producer.isIdempotence() || "all".equals(producer.getAcks()),
                "Kafka producer idempotence requires acks=all.");
    }

    /**
     * Checks the settings the consumer loop and its DLQ producer cannot start without.
     *
     * @throws IllegalArgumentException naming the first missing or invalid setting
     */
    public void validateConsumer() {
        require(hasText(bootstrapServers), "Kafka bootstrap-servers is missing from configuration.");
        require(hasText(consumer.getGroupId()), "Kafka group-id is missing from configuration.");
        require(!consumer.getTopics().isEmpty(), "No Kafka topics specified in configuration.");
        require(!dlq.getTopics().isEmpty(), "No Kafka DLQ topics specified in configuration.");
        require(hasText(dlq.getCatchAllTopic()), "Kafka catch-all DLQ topic is missing from configuration.");
        require(consumer.getBatchSize() > 0, "Kafka consumer batch-size must be positive.");
        require(consumer.getCommitIntervalMs() > 0, "Kafka consumer commit-interval-ms must be positive.");
        require(retry.getMaxAttempts() > 0, "Kafka consumer retry max-attempts must be positive.");
        require(!dlq.isIdempotence() || "all".equals(dlq.getAcks()),
                "Kafka DLQ idempotence requires acks=all.");
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public enum BackoffMode {
        LINEAR,
        EXPONENTIAL_JITTER
    }

    public static class Producer {
        private boolean enabled = false;
        private String acks = "all";
        private boolean idempotence = true;
        private int messageTimeoutMs = 5_000;
        private long sendTimeoutMs = 10_000L;
        private int maxRetries = 3;
        private int totalPartitions = 6;
        private BackoffMode backoff = BackoffMode.LINEAR;
        private long retryBaseDelayMs = 200L;
        private long maxBackoffMs = 30_000L;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getAcks() {
            return acks;
        }

        public void setAcks(String acks) {
            this.acks = acks;
        }

        public boolean isIdempotence() {
            return idempotence;
        }

        public void setIdempotence(boolean idempotence) {
            this.idempotence = idempotence;
        }

        public int getMessageTimeoutMs() {
            return messageTimeoutMs;
        }

        public void setMessageTimeoutMs(int messageTimeoutMs) {
            this.messageTimeoutMs = messageTimeoutMs;
        }

        public long getSendTimeoutMs() {
            return sendTimeoutMs;
        }

        public void setSendTimeoutMs(long sendTimeoutMs) {
            this.sendTimeoutMs = sendTimeoutMs;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public int getTotalPartitions() {
            return totalPartitions;
        }

        public void setTotalPartitions(int totalPartitions) {
            this.totalPartitions = totalPartitions;
        }

        public BackoffMode getBackoff() {
            return backoff;
        }

        public void setBackoff(BackoffMode backoff) {
            this.backoff = backoff;
        }

        public long getRetryBaseDelayMs() {
            return retryBaseDelayMs;
        }

        public void setRetryBaseDelayMs(long retryBaseDelayMs) {
            this.retryBaseDelayMs = retryBaseDelayMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }
    }

    public static class Consumer {
        private boolean enabled = false;
        private String groupId;
        private List<String> topics = new ArrayList<>();
        private String autoOffsetReset = "earliest";
        private long pollTimeoutMs = 100L;
        private long idleBackoffMs = 100L;
        private long errorBackoffMs = 1_000L;
        private int batchSize = 100;
        private long commitIntervalMs = 1_000L;
        private long closeTimeoutMs = 5_000L;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getGroupId() {
            return groupId;
        }

        public void setGroupId(String groupId) {
            this.groupId = groupId;
        }

        public List<String> getTopics() {
            return topics;
        }

        public void setTopics(List<String> topics) {
            this.topics = topics;
        }

        public String getAutoOffsetReset() {
            return autoOffsetReset;
        }

        public void setAutoOffsetReset(String autoOffsetReset) {
            this.autoOffsetReset = autoOffsetReset;
        }

        public long getPollTimeoutMs() {
            return pollTimeoutMs;
        }

        public void setPollTimeoutMs(long pollTimeoutMs) {
            this.pollTimeoutMs = pollTimeoutMs;
        }

        public long getIdleBackoffMs() {
            return idleBackoffMs;
        }

        public void setIdleBackoffMs(long idleBackoffMs) {
            this.idleBackoffMs = idleBackoffMs;
        }

        public long getErrorBackoffMs() {
            return errorBackoffMs;
        }

        public void setErrorBackoffMs(long errorBackoffMs) {
            this.errorBackoffMs = errorBackoffMs;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getCommitIntervalMs() {
            return commitIntervalMs;
        }

        public void setCommitIntervalMs(long commitIntervalMs) {
            this.commitIntervalMs = commitIntervalMs;
        }

        public long getCloseTimeoutMs() {
            return closeTimeoutMs;
        }

        public void setCloseTimeoutMs(long closeTimeoutMs) {
            this.closeTimeoutMs = closeTimeoutMs;
        }
    }

    /**
     * Consumer-side retry policy, shared by message dispatch and offset commits.
     */
    public static class Retry {
        private int maxAttempts = 3;
        private long initialBackoffMs = 100L;
        private double multiplier = 2.0;
        private long maxBackoffMs = 30_000L;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }
    }

    public static class Dlq {
        private List<String> topics = new ArrayList<>();
        private String suffix = Topics.DLQ_SUFFIX;
        private String catchAllTopic;
        private String acks = "all";
        private boolean idempotence = false;
        private int messageTimeoutMs = 5_000;

        public List<String> getTopics() {
            return topics;
        }

        public void setTopics(List<String> topics) {
            this.topics = topics;
        }

        public String getSuffix() {
            return suffix;
        }

        public void setSuffix(String suffix) {
            this.suffix = suffix;
        }

        public String getCatchAllTopic() {
            return catchAllTopic;
        }

        public void setCatchAllTopic(String catchAllTopic) {
            this.catchAllTopic = catchAllTopic;
        }

        public String getAcks() {
            return acks;
        }

        public void setAcks(String acks) {
            this.acks = acks;
        }

        public boolean isIdempotence() {
            return idempotence;
        }

        public void setIdempotence(boolean idempotence) {
            this.idempotence = idempotence;
        }

        public int getMessageTimeoutMs() {
            return messageTimeoutMs;
        }

        public void setMessageTimeoutMs(int messageTimeoutMs) {
            this.messageTimeoutMs = messageTimeoutMs;
        }
    }

    public static class Logging {
        private boolean mdcEnabled = true;

        public boolean isMdcEnabled() {
            return mdcEnabled;
        }

        public void setMdcEnabled(boolean mdcEnabled) {
            this.mdcEnabled = mdcEnabled;
        }
    }
}
