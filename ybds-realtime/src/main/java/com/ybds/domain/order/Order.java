package com.ybds.domain.order;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Order snapshot carried in order events.
 */
public record Order(
    String orderId,
    String customerId,
    CustomerType customerType,
    String paymentMethod,
    BigDecimal totalAmount,
    OrderStatus status,
    Instant createdAt
) {
    public Order withStatus(OrderStatus newStatus) {
        return new Order(orderId, customerId, customerType, paymentMethod, totalAmount, newStatus, createdAt);
    }

    public boolean placedByUser() {
        return customerType == CustomerType.USER && customerId != null;
    }
}
