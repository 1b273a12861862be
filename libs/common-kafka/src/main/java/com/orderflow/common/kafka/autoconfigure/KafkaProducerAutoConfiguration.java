package com.orderflow.common.kafka.autoconfigure;

import com.orderflow.common.kafka.config.CommonKafkaProperties;
import com.orderflow.common.kafka.delivery.ProducerErrorClassifier;
import com.orderflow.common.kafka.metrics.KafkaDeliveryMetrics;
import com.orderflow.common.kafka.producer.EventProducer;
import com.orderflow.common.kafka.producer.KafkaEventProducer;
import com.orderflow.common.kafka.support.CancellationSignal;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;

import java.util.HashMap;
import java.util.Map;

@AutoConfiguration(after = CommonKafkaAutoConfiguration.class)
@ConditionalOnProperty(prefix = "common.kafka.producer", name = "enabled", havingValue = "true")
public class KafkaProducerAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public EventProducer eventProducer(CommonKafkaProperties props,
                                       ProducerErrorClassifier classifier,
                                       KafkaDeliveryMetrics metrics,
                                       CancellationSignal cancellation) {
        KafkaTemplate<String, String> template = new KafkaTemplate<>(new DefaultKafkaProducerFactory<>(producerConfig(props)));
        return new KafkaEventProducer(template, props, classifier, metrics, cancellation);
    }

    /**
     * Client retries are left at the Kafka default: idempotence needs them above zero, and
     * {@code delivery.timeout.ms} bounds each application-level attempt to {@code message-timeout-ms}.
     */
    static Map<String, Object> producerConfig(CommonKafkaProperties props) {
        CommonKafkaProperties.Producer producer = props.getProducer();
        Map<String, Object> config = new HashMap<>();
        config.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, props.getBootstrapServers());
        config.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        config.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        config.put(ProducerConfig.ACKS_CONFIG, producer.getAcks());
        config.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, producer.isIdempotence());
        config.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, producer.getMessageTimeoutMs());
        config.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, producer.getMessageTimeoutMs());
        config.put(ProducerConfig.LINGER_MS_CONFIG, 0);
        config.put(ProducerConfig.RETRY_BACKOFF_MS_CONFIG, producer.getRetryBaseDelayMs());
        return config;
    }
}
