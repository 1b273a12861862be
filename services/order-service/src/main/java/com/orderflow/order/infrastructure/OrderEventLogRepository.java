package com.orderflow.order.infrastructure;

import com.orderflow.order.domain.OrderEventLog;

import java.util.List;

public interface OrderEventLogRepository {

    void append(OrderEventLog entry);

    /**
     * @return entries for the order in the order they were appended
     */
    List<OrderEventLog> findByOrderId(long orderId);
}
