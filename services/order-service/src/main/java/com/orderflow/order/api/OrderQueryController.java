package com.orderflow.order.api;

import com.orderflow.order.api.dto.OrderPageResponse;
import com.orderflow.order.api.dto.OrderResponse;
import com.orderflow.order.application.OrderQueryService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/orders")
public class OrderQueryController {

    private final OrderQueryService queryService;

    public OrderQueryController(OrderQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping("/{id}")
    public ResponseEntity<OrderResponse> getOrder(@PathVariable("id") long id) {
        return queryService.findOrder(id)
                .map(OrderResponse::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/user")
    public List<OrderResponse> getOrdersByUser(@RequestHeader(name = "X-User-Id") String userIdHeader) {
        return queryService.findOrdersByUser(parseUserId(userIdHeader)).stream()
                .map(OrderResponse::from)
                .toList();
    }

    @GetMapping
    public OrderPageResponse listOrders(
            @RequestParam(name = "startDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "endDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(name = "pageSize", defaultValue = "20") int pageSize,
            @RequestParam(name = "pageNumber", defaultValue = "1") int pageNumber) {
        return OrderPageResponse.from(queryService.listOrders(startDate, endDate, pageSize, pageNumber));
    }

    private static long parseUserId(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("X-User-Id must be numeric");
        }
    }
}
