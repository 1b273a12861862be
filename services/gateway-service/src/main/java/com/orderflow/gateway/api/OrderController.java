package com.orderflow.gateway.api;

import com.orderflow.common.kafka.delivery.DeliveryOutcome;
import com.orderflow.contracts.events.OrderEvent;
import com.orderflow.contracts.events.OrderLineItem;
import com.orderflow.gateway.api.dto.OrderItemRequest;
import com.orderflow.gateway.api.dto.OrderRequest;
import com.orderflow.gateway.api.dto.PublishResponse;
import com.orderflow.gateway.application.OrderCommandPublisher;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/orders")
@Validated
public class OrderController {

    private final OrderCommandPublisher publisher;
    private final String defaultUserId;

    public OrderController(OrderCommandPublisher publisher,
                           @Value("${gateway.orders.default-user-id:1}") String defaultUserId) {
        this.publisher = publisher;
        this.defaultUserId = defaultUserId;
    }

    @PostMapping
    public ResponseEntity<PublishResponse> create(
            @RequestHeader(name = "X-User-Id", required = false) String userIdHeader,
            @Valid @RequestBody OrderRequest request) {
        if (request.id() == null) {
            throw new IllegalArgumentException("Order id is required");
        }
        return respond(publisher.create(toEvent(request.id(), resolveUserId(userIdHeader), request)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<PublishResponse> update(
            @PathVariable @Positive long id,
            @RequestHeader(name = "X-User-Id", required = false) String userIdHeader,
            @Valid @RequestBody OrderRequest request) {
        return respond(publisher.update(toEvent(id, resolveUserId(userIdHeader), request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<PublishResponse> delete(@PathVariable @Positive long id) {
        return respond(publisher.delete(id));
    }

    private ResponseEntity<PublishResponse> respond(DeliveryOutcome outcome) {
        HttpStatus status = outcome.isSuccess() ? HttpStatus.ACCEPTED : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(PublishResponse.from(outcome));
    }

    private static OrderEvent toEvent(long id, long userId, OrderRequest request) {
        List<OrderItemRequest> items = request.items() == null ? List.of() : request.items();
        return new OrderEvent(
                id,
                userId,
                request.status(),
                request.netAmount(),
                request.orderDate(),
                items.stream()
                        .map(item -> new OrderLineItem(item.id(), item.productId(), item.quantity(), item.unitPrice()))
                        .toList());
    }

    private long resolveUserId(String userIdHeader) {
        String value = StringUtils.hasText(userIdHeader) ? userIdHeader.trim() : defaultUserId;
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("X-User-Id must be numeric");
        }
    }
}
