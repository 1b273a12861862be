package com.orderflow.contracts.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class OrderEventJsonTest {

    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();

    @Test
    void readsOrderAndIgnoresUnknownFields() throws Exception {
        String json = """
                {"id":42,"userId":7,"status":"Pending","netAmount":19.90,
                 "orderDate":"2024-05-01T10:15:30Z","couponCode":"X",
                 "items":[{"id":1,"productId":100,"quantity":2,"unitPrice":9.95}]}
                """;

        OrderEvent event = mapper.readValue(json, OrderEvent.class);

        assertThat(event.id()).isEqualTo(42L);
        assertThat(event.orderDate()).isEqualTo(Instant.parse("2024-05-01T10:15:30Z"));
        assertThat(event.items()).hasSize(1);
        assertThat(event.items().get(0).grossAmount()).isEqualByComparingTo(new BigDecimal("19.90"));
    }

    @Test
    void minimalPayloadHasEmptyItems() throws Exception {
        OrderEvent event = mapper.readValue("{\"id\":42}", OrderEvent.class);

        assertThat(event.id()).isEqualTo(42L);
        assertThat(event.items()).isEmpty();
    }

    @Test
    void deadLetterEnvelopeUsesWireFieldNames() throws Exception {
        DeadLetterEnvelope envelope = new DeadLetterEnvelope("order-create", "{\"id\":42}", "42",
                "boom", "trace", Instant.parse("2024-05-01T10:15:30Z"), 1, 9L);

        JsonNode node = mapper.readTree(mapper.writeValueAsString(envelope));

        assertThat(node.fieldNames()).toIterable().containsExactlyInAnyOrder(
                "OriginalTopic", "OriginalMessage", "Key", "Exception", "StackTrace", "TimeStamp", "Partition", "Offset");
        assertThat(mapper.treeToValue(node, DeadLetterEnvelope.class)).isEqualTo(envelope);
    }
}
