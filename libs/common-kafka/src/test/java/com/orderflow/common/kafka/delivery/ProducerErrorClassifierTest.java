package com.orderflow.common.kafka.delivery;

import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.BrokerNotAvailableException;
import org.apache.kafka.common.errors.CorruptRecordException;
import org.apache.kafka.common.errors.InvalidTopicException;
import org.apache.kafka.common.errors.NetworkException;
import org.apache.kafka.common.errors.NotLeaderOrFollowerException;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.errors.TimeoutException;
import org.apache.kafka.common.errors.TopicAuthorizationException;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.KafkaProducerException;

import java.util.Set;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;

class ProducerErrorClassifierTest {

    private final ProducerErrorClassifier classifier = new ProducerErrorClassifier();

    @Test
    void fatalErrors() {
        assertThat(classifier.classify(new TopicAuthorizationException(Set.of("t")))).isEqualTo(ProducerErrorKind.AUTHORIZATION);
        assertThat(classifier.classify(new InvalidTopicException("bad"))).isEqualTo(ProducerErrorKind.INVALID_REQUEST);
        assertThat(classifier.classify(new SerializationException("bad"))).isEqualTo(ProducerErrorKind.SERIALIZATION);
        assertThat(classifier.classify(new RecordTooLargeException("big"))).isEqualTo(ProducerErrorKind.RECORD_TOO_LARGE);
        assertThat(classifier.classify(new IllegalStateException("?"))).isEqualTo(ProducerErrorKind.UNKNOWN);
        assertThat(classifier.isRetriable(new IllegalStateException("?"))).isFalse();
    }

    @Test
    void retriableErrors() {
        assertThat(classifier.classify(new BrokerNotAvailableException("down"))).isEqualTo(ProducerErrorKind.BROKER_UNAVAILABLE);
        assertThat(classifier.classify(new NotLeaderOrFollowerException("moved"))).isEqualTo(ProducerErrorKind.LEADER_UNAVAILABLE);
        assertThat(classifier.classify(new TimeoutException("slow"))).isEqualTo(ProducerErrorKind.TIMEOUT);
        assertThat(classifier.classify(new java.util.concurrent.TimeoutException())).isEqualTo(ProducerErrorKind.TIMEOUT);
        assertThat(classifier.classify(new NetworkException("reset"))).isEqualTo(ProducerErrorKind.NETWORK);
        assertThat(classifier.classify(new CorruptRecordException("crc"))).isEqualTo(ProducerErrorKind.OTHER_RETRIABLE);
    }

    @Test
    void unwrapsFutureAndTemplateWrappers() {
        KafkaProducerException templateError = new KafkaProducerException(
                new ProducerRecord<>("t", "v"), "Failed to send", new TimeoutException("expired"));
        ExecutionException wrapped = new ExecutionException(templateError);

        assertThat(classifier.classify(wrapped)).isEqualTo(ProducerErrorKind.TIMEOUT);
        assertThat(classifier.isRetriable(wrapped)).isTrue();
        assertThat(classifier.describe(wrapped)).isEqualTo("expired");
    }

    @Test
    void describeFallsBackToClassName() {
        assertThat(classifier.describe(new NetworkException())).isEqualTo("NetworkException");
    }
}
