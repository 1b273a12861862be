package com.orderflow.order.infrastructure.memory;

import com.orderflow.order.domain.Order;
import com.orderflow.order.domain.OrderItem;
import com.orderflow.order.infrastructure.DuplicateKeyException;
import com.orderflow.order.infrastructure.OrderNotFoundException;
import com.orderflow.order.infrastructure.OrderRepository;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps orders in memory, keyed by order id. Line items without an id get one on write.
 */
@Repository
public class InMemoryOrderRepository implements OrderRepository {

    private final Map<Long, Order> store = new ConcurrentHashMap<>();
    private final AtomicLong itemIdGenerator = new AtomicLong(1);
    private final Clock clock;

    public InMemoryOrderRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Order insert(Order order) {
        Order stored = order.withItems(assignItemIds(order.items()));
        if (store.putIfAbsent(order.id(), stored) != null) {
            throw new DuplicateKeyException(order.id());
        }
        return stored;
    }

    @Override
    public Order update(Order order) {
        Order stored = order.withItems(assignItemIds(order.items()));
        Order result = store.computeIfPresent(order.id(), (id, current) -> current.deleted() ? current : stored);
        if (result != stored) {
            throw new OrderNotFoundException(order.id());
        }
        return stored;
    }

    @Override
    public Optional<Order> findById(long id) {
        return Optional.ofNullable(store.get(id));
    }

    @Override
    public List<Order> findAll() {
        return List.copyOf(store.values());
    }

    @Override
    public boolean softDelete(long id, long actorUserId) {
        boolean[] deleted = new boolean[1];
        store.computeIfPresent(id, (key, current) -> {
            if (current.deleted()) {
                return current;
            }
            deleted[0] = true;
            return current.markDeleted(actorUserId, clock.instant());
        });
        return deleted[0];
    }

    private List<OrderItem> assignItemIds(List<OrderItem> items) {
        return items.stream()
                .map(item -> item.id() == null || item.id() == 0 ? item.withId(itemIdGenerator.getAndIncrement()) : item)
                .toList();
    }
}
