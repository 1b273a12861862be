package com.orderflow.common.kafka.delivery;

public enum ProducerErrorKind {
    AUTHORIZATION(false),
    INVALID_REQUEST(false),
    SERIALIZATION(false),
    RECORD_TOO_LARGE(false),
    BROKER_UNAVAILABLE(true),
    LEADER_UNAVAILABLE(true),
    TIMEOUT(true),
    NOT_ENOUGH_REPLICAS(true),
    NETWORK(true),
    OTHER_RETRIABLE(true),
    UNKNOWN(false);

    private final boolean retriable;

    ProducerErrorKind(boolean retriable) {
        this.retriable = retriable;
    }

    public boolean isRetriable() {
        return retriable;
    }

    public boolean isFatal() {
        return !retriable;
    }
}
