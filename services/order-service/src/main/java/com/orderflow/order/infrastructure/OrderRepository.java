package com.orderflow.order.infrastructure;

import com.orderflow.order.domain.Order;

import java.util.List;
import java.util.Optional;

public interface OrderRepository {

    /**
     * @throws DuplicateKeyException if an order with the same id was stored before, deleted or not
     */
    Order insert(Order order);

    /**
     * @throws OrderNotFoundException if no live order has this id
     */
    Order update(Order order);

    Optional<Order> findById(long id);

    /**
     * @return every stored order, deleted ones included
     */
    List<Order> findAll();

    /**
     * @return {@code false} if the order is missing or already deleted
     */
    boolean softDelete(long id, long actorUserId);
}
