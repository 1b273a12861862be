package com.orderflow.contracts.events;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Value written to a dead-letter topic. Carries the original record verbatim plus the
 * failure that sent it there, enough to replay or inspect it later.
 */
public record DeadLetterEnvelope(
        @JsonProperty("OriginalTopic") String originalTopic,
        @JsonProperty("OriginalMessage") String originalMessage,
        @JsonProperty("Key") String key,
        @JsonProperty("Exception") String exception,
        @JsonProperty("StackTrace") String stackTrace,
        @JsonProperty("TimeStamp") Instant timestamp,
        @JsonProperty("Partition") int partition,
        @JsonProperty("Offset") long offset
) {
}
