package com.orderflow.common.kafka.delivery;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProcessingOutcomeTest {

    @Test
    void failedIsRetryableAndRejectedIsNot() {
        assertThat(ProcessingOutcome.failed("boom").retryable()).isTrue();
        assertThat(ProcessingOutcome.rejected("bad payload").retryable()).isFalse();
        assertThat(ProcessingOutcome.succeeded("ok").success()).isTrue();
    }

    @Test
    void failureCarriesStackTrace() {
        ProcessingOutcome outcome = ProcessingOutcome.failed("boom", new IllegalStateException("db down"));

        assertThat(outcome.detail())
                .contains("java.lang.IllegalStateException: db down")
                .contains("ProcessingOutcomeTest");
    }

    @Test
    void cancelledDeliveryIsNotSuccess() {
        DeliveryOutcome outcome = DeliveryOutcome.cancelled("order-create", 1);

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.isCancelled()).isTrue();
        assertThat(outcome.offset()).isNull();
    }
}
