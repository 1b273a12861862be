package com.orderflow.order.messaging;

import com.orderflow.common.kafka.config.CommonKafkaProperties;
import com.orderflow.common.kafka.consumer.ProcessingDispatcher;
import com.orderflow.common.kafka.consumer.RecordHandlerRegistry;
import com.orderflow.common.kafka.delivery.ProcessingOutcome;
import com.orderflow.common.kafka.support.CancellationSignal;
import com.orderflow.contracts.Topics;
import com.orderflow.order.application.OrderProcessor;
import com.orderflow.order.infrastructure.OrderRepository;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "common.kafka.consumer.enabled=false")
class OrderEventHandlersTest {

    @Autowired
    RecordHandlerRegistry registry;

    @Autowired
    OrderRepository repository;

    @Autowired
    ApplicationContext context;

    @Autowired
    CommonKafkaProperties kafkaProperties;

    private ProcessingDispatcher dispatcher() {
        CommonKafkaProperties.Retry retry = new CommonKafkaProperties.Retry();
        retry.setInitialBackoffMs(1);
        return new ProcessingDispatcher(registry, retry, new CancellationSignal());
    }

    @Test
    void registersAllOrderTopics() {
        assertThat(registry.topics()).containsExactlyInAnyOrder(
                Topics.ORDER_CREATE, Topics.ORDER_UPDATE, Topics.ORDER_DELETE);
    }

    @Test
    void everyOrderTopicHasItsDeadLetterTopic() {
        assertThat(kafkaProperties.getConsumer().getTopics()).containsExactlyInAnyOrderElementsOf(registry.topics());
        assertThat(kafkaProperties.getDlq().getTopics()).containsExactlyInAnyOrder(
                Topics.ORDER_CREATE_DLQ, Topics.ORDER_UPDATE_DLQ, Topics.ORDER_DELETE_DLQ);
        assertThat(kafkaProperties.getDlq().getCatchAllTopic()).isEqualTo(Topics.CATCH_ALL_DLQ);
    }

    @Test
    void processorIsFreshPerLookup() {
        assertThat(context.getBean(OrderProcessor.class)).isNotSameAs(context.getBean(OrderProcessor.class));
    }

    @Test
    void redeliveredCreateIsProcessedOnce() {
        ConsumerRecord<String, String> record = new ConsumerRecord<>(Topics.ORDER_CREATE, 0, 0L, "501",
                "{\"id\":501,\"userId\":3,\"status\":\"Pending\",\"items\":[{\"productId\":9,\"quantity\":1,\"unitPrice\":4.50}]}");

        ProcessingOutcome first = dispatcher().dispatch(record);
        ProcessingOutcome second = dispatcher().dispatch(record);

        assertThat(first.success()).isTrue();
        assertThat(second.success()).isTrue();
        assertThat(repository.findById(501).orElseThrow().items()).hasSize(1);
    }

    @Test
    void deleteNeedsOnlyTheId() {
        dispatcher().dispatch(new ConsumerRecord<>(Topics.ORDER_CREATE, 0, 1L, "502", "{\"id\":502}"));

        ProcessingOutcome outcome = dispatcher().dispatch(
                new ConsumerRecord<>(Topics.ORDER_DELETE, 0, 2L, "502", "{\"id\":502}"));

        assertThat(outcome.success()).isTrue();
        assertThat(repository.findById(502).orElseThrow().deleted()).isTrue();
    }

    @Test
    void malformedPayloadIsRejected() {
        ProcessingOutcome outcome = dispatcher().dispatch(
                new ConsumerRecord<>(Topics.ORDER_UPDATE, 0, 3L, "503", "not-json"));

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.retryable()).isFalse();
    }
}
