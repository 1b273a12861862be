package com.orderflow.common.kafka.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderflow.common.kafka.config.CommonKafkaProperties;
import com.orderflow.common.kafka.consumer.ConsumerLoopLifecycle;
import com.orderflow.common.kafka.consumer.DeadLetterRouter;
import com.orderflow.common.kafka.consumer.EventConsumerLoop;
import com.orderflow.common.kafka.consumer.OffsetTracker;
import com.orderflow.common.kafka.consumer.ProcessingDispatcher;
import com.orderflow.common.kafka.consumer.RecordHandlerRegistry;
import com.orderflow.common.kafka.metrics.KafkaDeliveryMetrics;
import com.orderflow.common.kafka.support.CancellationSignal;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;

import java.util.HashMap;
import java.util.Map;

@AutoConfiguration(after = CommonKafkaAutoConfiguration.class)
@ConditionalOnProperty(prefix = "common.kafka.consumer", name = "enabled", havingValue = "true")
@ConditionalOnBean(RecordHandlerRegistry.class)
public class KafkaConsumerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ProcessingDispatcher processingDispatcher(RecordHandlerRegistry registry,
                                                     CommonKafkaProperties props,
                                                     CancellationSignal cancellation) {
        return new ProcessingDispatcher(registry, props.getRetry(), cancellation);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterRouter deadLetterRouter(CommonKafkaProperties props,
                                             ObjectProvider<ObjectMapper> objectMapper,
                                             CancellationSignal cancellation,
                                             KafkaDeliveryMetrics metrics) {
        CommonKafkaProperties.Dlq dlq = props.getDlq();
        Map<String, Object> config = new HashMap<>();
        config.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, props.getBootstrapServers());
        config.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        config.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        config.put(ProducerConfig.ACKS_CONFIG, dlq.getAcks());
        config.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, dlq.isIdempotence());
        config.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, dlq.getMessageTimeoutMs());
        config.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, dlq.getMessageTimeoutMs());
        config.put(ProducerConfig.LINGER_MS_CONFIG, 0);
        KafkaTemplate<String, String> template = new KafkaTemplate<>(new DefaultKafkaProducerFactory<>(config));
        return new DeadLetterRouter(template, dlq, CommonKafkaAutoConfiguration.objectMapper(objectMapper),
                cancellation, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public OffsetTracker offsetTracker(CommonKafkaProperties props,
                                       CancellationSignal cancellation,
                                       KafkaDeliveryMetrics metrics) {
        return new OffsetTracker(props.getRetry(), cancellation, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public EventConsumerLoop eventConsumerLoop(CommonKafkaProperties props,
                                               ProcessingDispatcher dispatcher,
                                               DeadLetterRouter deadLetterRouter,
                                               OffsetTracker offsetTracker,
                                               CancellationSignal cancellation,
                                               KafkaDeliveryMetrics metrics) {
        CommonKafkaProperties.Consumer consumer = props.getConsumer();
        Map<String, Object> config = new HashMap<>();
        config.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, props.getBootstrapServers());
        config.put(ConsumerConfig.GROUP_ID_CONFIG, consumer.getGroupId());
        config.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        config.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        config.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        config.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, consumer.getAutoOffsetReset());
        config.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, consumer.getBatchSize());
        DefaultKafkaConsumerFactory<String, String> factory = new DefaultKafkaConsumerFactory<>(config);
        return new EventConsumerLoop(props, factory::createConsumer, dispatcher, deadLetterRouter,
                offsetTracker, cancellation, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConsumerLoopLifecycle consumerLoopLifecycle(EventConsumerLoop loop,
                                                       CancellationSignal cancellation,
                                                       CommonKafkaProperties props) {
        return new ConsumerLoopLifecycle(loop, cancellation, props.getConsumer().getCloseTimeoutMs() * 2);
    }
}
