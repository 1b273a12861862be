package com.orderflow.order.application;

import com.orderflow.order.domain.Order;
import com.orderflow.order.infrastructure.OrderRepository;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the order store. Deleted orders are never returned.
 */
@Service
public class OrderQueryService {

    private static final Comparator<Order> NEWEST_FIRST = Comparator
            .comparing(Order::orderDate, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(Order::id, Comparator.<Long>reverseOrder());

    private final OrderRepository repository;

    public OrderQueryService(OrderRepository repository) {
        this.repository = repository;
    }

    public Optional<Order> findOrder(long id) {
        return repository.findById(id).filter(order -> !order.deleted());
    }

    public List<Order> findOrdersByUser(long userId) {
        return repository.findAll().stream()
                .filter(order -> !order.deleted() && order.userId() != null && order.userId() == userId)
                .sorted(NEWEST_FIRST)
                .toList();
    }

    /**
     * Orders whose order date falls within {@code [startDate, endDate]} (UTC), newest first.
     *
     * @param pageNumber 1-based; a page past the end is empty
     * @throws IllegalArgumentException if the range is inverted or paging values are not positive
     */
    public OrderPage listOrders(LocalDate startDate, LocalDate endDate, int pageSize, int pageNumber) {
        if (startDate == null || endDate == null || startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("startDate must not be after endDate");
        }
        if (pageSize <= 0 || pageNumber <= 0) {
            throw new IllegalArgumentException("pageSize and pageNumber must be positive");
        }
        List<Order> matching = repository.findAll().stream()
                .filter(order -> !order.deleted() && order.orderDate() != null)
                .filter(order -> {
                    LocalDate day = order.orderDate().atZone(ZoneOffset.UTC).toLocalDate();
                    return !day.isBefore(startDate) && !day.isAfter(endDate);
                })
                .sorted(NEWEST_FIRST)
                .toList();

        int total = matching.size();
        int totalPages = (total + pageSize - 1) / pageSize;
        List<Order> page = matching.stream()
                .skip((long) (pageNumber - 1) * pageSize)
                .limit(pageSize)
                .toList();
        return new OrderPage(pageNumber, pageSize, totalPages, total, page);
    }
}
