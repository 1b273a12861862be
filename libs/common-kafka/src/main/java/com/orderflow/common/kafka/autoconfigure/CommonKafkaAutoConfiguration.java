package com.orderflow.common.kafka.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.orderflow.common.kafka.config.CommonKafkaProperties;
import com.orderflow.common.kafka.delivery.ProducerErrorClassifier;
import com.orderflow.common.kafka.metrics.KafkaDeliveryMetrics;
import com.orderflow.common.kafka.support.CancellationSignal;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.core.KafkaTemplate;

@AutoConfiguration
@EnableConfigurationProperties(CommonKafkaProperties.class)
@ConditionalOnClass(KafkaTemplate.class)
public class CommonKafkaAutoConfiguration {

    @Bean(destroyMethod = "cancel")
    @ConditionalOnMissingBean
    public CancellationSignal cancellationSignal() {
        return new CancellationSignal();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProducerErrorClassifier producerErrorClassifier() {
        return new ProducerErrorClassifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public KafkaDeliveryMetrics kafkaDeliveryMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        return new KafkaDeliveryMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    static ObjectMapper objectMapper(ObjectProvider<ObjectMapper> objectMapper) {
        return objectMapper.getIfAvailable(() -> JsonMapper.builder().findAndAddModules().build());
    }
}
