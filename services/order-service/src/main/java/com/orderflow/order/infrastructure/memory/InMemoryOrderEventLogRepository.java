package com.orderflow.order.infrastructure.memory;

import com.orderflow.order.domain.OrderEventLog;
import com.orderflow.order.infrastructure.OrderEventLogRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

@Repository
public class InMemoryOrderEventLogRepository implements OrderEventLogRepository {

    private final Queue<OrderEventLog> entries = new ConcurrentLinkedQueue<>();

    @Override
    public void append(OrderEventLog entry) {
        entries.add(entry);
    }

    @Override
    public List<OrderEventLog> findByOrderId(long orderId) {
        return entries.stream().filter(entry -> entry.orderId() == orderId).toList();
    }
}
