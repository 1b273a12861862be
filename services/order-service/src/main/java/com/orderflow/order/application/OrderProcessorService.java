package com.orderflow.order.application;

import com.orderflow.common.kafka.delivery.ProcessingOutcome;
import com.orderflow.contracts.events.OrderEvent;
import com.orderflow.contracts.events.OrderLineItem;
import com.orderflow.order.domain.Order;
import com.orderflow.order.domain.OrderEventLog;
import com.orderflow.order.domain.OrderEventType;
import com.orderflow.order.domain.OrderItem;
import com.orderflow.order.infrastructure.DuplicateKeyException;
import com.orderflow.order.infrastructure.OrderEventLogRepository;
import com.orderflow.order.infrastructure.OrderNotFoundException;
import com.orderflow.order.infrastructure.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Prototype scoped: one instance per dispatched record, no state carried between messages.
 */
@Service
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
public class OrderProcessorService implements OrderProcessor {

    private static final Logger log = LoggerFactory.getLogger(OrderProcessorService.class);

    private final OrderRepository repository;
    private final OrderEventLogRepository eventLog;
    private final Clock clock;

    public OrderProcessorService(OrderRepository repository, OrderEventLogRepository eventLog, Clock clock) {
        this.repository = repository;
        this.eventLog = eventLog;
        this.clock = clock;
    }

    @Override
    public ProcessingOutcome createOrder(OrderEvent event, long userId) {
        if (event.id() == null) {
            return ProcessingOutcome.rejected("Order id is required");
        }
        logEvent(event.id(), OrderEventType.CREATE, userId);
        Instant now = clock.instant();
        Order order = new Order(
                event.id(),
                event.userId() != null ? event.userId() : userId,
                event.status(),
                event.netAmount(),
                event.orderDate() != null ? event.orderDate() : now,
                event.items().stream().map(OrderProcessorService::toItem).toList(),
                false,
                userId,
                now,
                null,
                null);
        try {
            Order stored = repository.insert(order);
            log.info("Order created orderId={} items={}", stored.id(), stored.items().size());
            return ProcessingOutcome.succeeded("Added successfully", stored);
        } catch (DuplicateKeyException e) {
            log.info("Order already exists, create treated as applied orderId={}", event.id());
            return ProcessingOutcome.succeeded("Order already exists",
                    repository.findById(event.id()).orElse(null));
        }
    }

    @Override
    public ProcessingOutcome updateOrder(OrderEvent event, long userId) {
        if (event.id() == null) {
            return ProcessingOutcome.rejected("Order id is required");
        }
        logEvent(event.id(), OrderEventType.UPDATE, userId);
        Optional<Order> current = repository.findById(event.id()).filter(order -> !order.deleted());
        if (current.isEmpty()) {
            return ProcessingOutcome.failed("Order " + event.id() + " not found");
        }
        Order existing = current.get();
        Order updated = new Order(
                existing.id(),
                existing.userId(),
                event.status() != null ? event.status() : existing.status(),
                event.netAmount() != null ? event.netAmount() : existing.netAmount(),
                event.orderDate() != null ? event.orderDate() : existing.orderDate(),
                reconcileItems(existing, event.items()),
                false,
                existing.createdBy(),
                existing.createdAt(),
                userId,
                clock.instant());
        try {
            Order stored = repository.update(updated);
            log.info("Order updated orderId={} activeItems={}", stored.id(), stored.activeItems().size());
            return ProcessingOutcome.succeeded("Updated successfully", stored);
        } catch (OrderNotFoundException e) {
            return ProcessingOutcome.failed(e.getMessage(), e);
        }
    }

    @Override
    public ProcessingOutcome deleteOrder(long orderId, long userId) {
        logEvent(orderId, OrderEventType.DELETE, userId);
        if (repository.softDelete(orderId, userId)) {
            log.info("Order deleted orderId={}", orderId);
            return ProcessingOutcome.succeeded("Deleted successfully");
        }
        log.info("Order missing or already deleted, delete treated as applied orderId={}", orderId);
        return ProcessingOutcome.succeeded("Order already deleted");
    }

    /**
     * Requested lines without an id are added, lines whose id matches a stored line replace it
     * when changed, stored lines absent from the request are marked deleted.
     */
    private List<OrderItem> reconcileItems(Order existing, List<OrderLineItem> requested) {
        Map<Long, OrderItem> stored = existing.activeItems().stream()
                .collect(Collectors.toMap(OrderItem::id, Function.identity()));
        List<OrderItem> result = new ArrayList<>();

        for (OrderLineItem line : requested) {
            OrderItem item = toItem(line);
            if (line.id() == null || line.id() == 0) {
                result.add(item);
                continue;
            }
            OrderItem match = stored.remove(line.id());
            if (match == null) {
                log.warn("Ignoring unknown order item orderId={} itemId={}", existing.id(), line.id());
            } else {
                result.add(match.differsFrom(item) ? item : match);
            }
        }
        stored.values().forEach(item -> result.add(item.markDeleted()));
        existing.items().stream().filter(OrderItem::deleted).forEach(result::add);
        return result;
    }

    private void logEvent(long orderId, OrderEventType type, long userId) {
        eventLog.append(new OrderEventLog(orderId, type, userId, clock.instant()));
    }

    private static OrderItem toItem(OrderLineItem line) {
        return OrderItem.of(line.id(), line.productId(), line.quantity(), line.unitPrice());
    }
}
