package com.orderflow.common.kafka.delivery;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.AuthenticationException;
import org.apache.kafka.common.errors.AuthorizationException;
import org.apache.kafka.common.errors.BrokerNotAvailableException;
import org.apache.kafka.common.errors.DisconnectException;
import org.apache.kafka.common.errors.InvalidPartitionsException;
import org.apache.kafka.common.errors.InvalidTopicException;
import org.apache.kafka.common.errors.LeaderNotAvailableException;
import org.apache.kafka.common.errors.NetworkException;
import org.apache.kafka.common.errors.NotEnoughReplicasAfterAppendException;
import org.apache.kafka.common.errors.NotEnoughReplicasException;
import org.apache.kafka.common.errors.NotLeaderOrFollowerException;
import org.apache.kafka.common.errors.RecordBatchTooLargeException;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.apache.kafka.common.errors.RetriableException;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.errors.UnknownTopicOrPartitionException;
import org.springframework.kafka.core.KafkaProducerException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps a produce failure onto a {@link ProducerErrorKind}. Wrappers added by futures and by
 * {@code KafkaTemplate} are peeled off first so the broker error decides.
 */
public class ProducerErrorClassifier {

    public ProducerErrorKind classify(Throwable ex) {
        Throwable cause = unwrap(ex);
        if (cause instanceof AuthorizationException || cause instanceof AuthenticationException) {
            return ProducerErrorKind.AUTHORIZATION;
        }
        if (cause instanceof InvalidTopicException
                || cause instanceof InvalidPartitionsException
                || cause instanceof UnknownTopicOrPartitionException
                || cause instanceof IllegalArgumentException) {
            return ProducerErrorKind.INVALID_REQUEST;
        }
        if (cause instanceof SerializationException || cause instanceof JsonProcessingException) {
            return ProducerErrorKind.SERIALIZATION;
        }
        if (cause instanceof RecordTooLargeException || cause instanceof RecordBatchTooLargeException) {
            return ProducerErrorKind.RECORD_TOO_LARGE;
        }
        if (cause instanceof BrokerNotAvailableException) {
            return ProducerErrorKind.BROKER_UNAVAILABLE;
        }
        if (cause instanceof LeaderNotAvailableException || cause instanceof NotLeaderOrFollowerException) {
            return ProducerErrorKind.LEADER_UNAVAILABLE;
        }
        if (cause instanceof org.apache.kafka.common.errors.TimeoutException || cause instanceof TimeoutException) {
            return ProducerErrorKind.TIMEOUT;
        }
        if (cause instanceof NotEnoughReplicasException || cause instanceof NotEnoughReplicasAfterAppendException) {
            return ProducerErrorKind.NOT_ENOUGH_REPLICAS;
        }
        if (cause instanceof NetworkException || cause instanceof DisconnectException) {
            return ProducerErrorKind.NETWORK;
        }
        if (cause instanceof RetriableException) {
            return ProducerErrorKind.OTHER_RETRIABLE;
        }
        return ProducerErrorKind.UNKNOWN;
    }

    public boolean isRetriable(Throwable ex) {
        return classify(ex).isRetriable();
    }

    /**
     * Message of the innermost meaningful cause, falling back to its class name.
     */
    public String describe(Throwable ex) {
        Throwable cause = unwrap(ex);
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while (current.getCause() != null && current.getCause() != current && isWrapper(current)) {
            current = current.getCause();
        }
        return current;
    }

    private boolean isWrapper(Throwable ex) {
        return ex instanceof ExecutionException
                || ex instanceof CompletionException
                || ex instanceof KafkaProducerException
                || ex.getClass() == KafkaException.class;
    }
}
