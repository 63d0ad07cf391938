package com.ybds.service.order;

import com.ybds.domain.common.EventType;
import com.ybds.domain.order.Order;
import com.ybds.domain.order.OrderStatus;
import com.ybds.service.core.EventService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Pushes order lifecycle events to staff dashboards and to the ordering user.
 *
 * Routing:
 * - created: topic {@code orders.updates} and role {@code admin}
 * - status changed: topic {@code orders.updates}, topic {@code orders.<orderId>} and
 *   the customer's own connections when the order belongs to a registered user
 *
 * Entry point for the order service, which lives outside this module: it builds one
 * instance around the shared {@link EventService} and calls it after each order
 * change is committed. Nothing in the realtime process calls it on its own.
 */
public final class OrderEventPublisher {
    private static final Logger log = LoggerFactory.getLogger(OrderEventPublisher.class);

    public static final String TOPIC_ORDER_UPDATES = "orders.updates";
    public static final String ROLE_ADMIN = "admin";

    private final EventService events;

    public OrderEventPublisher(EventService events) {
        this.events = events;
    }

    public static String orderTopic(String orderId) {
        return "orders." + orderId;
    }

    public int orderCreated(Order order) {
        int delivered = events.emitTopic(EventType.ORDER_CREATED, TOPIC_ORDER_UPDATES, order)
            + events.emitRole(EventType.ORDER_CREATED, ROLE_ADMIN, order);
        log.info("Order created event: orderId={}, delivered={}", order.orderId(), delivered);
        return delivered;
    }

    public int orderStatusChanged(Order order, OrderStatus from, OrderStatus to) {
        StatusChange change = new StatusChange(order.orderId(), from, to, order.withStatus(to), Instant.now());

        int delivered = events.emitTopic(EventType.ORDER_STATUS_CHANGED, TOPIC_ORDER_UPDATES, change)
            + events.emitTopic(EventType.ORDER_STATUS_CHANGED, orderTopic(order.orderId()), change);
        if (order.placedByUser()) {
            delivered += events.emitUser(EventType.ORDER_STATUS_CHANGED, order.customerId(), change);
        }
        log.info("Order status event: orderId={}, {} -> {}, delivered={}", order.orderId(), from, to, delivered);
        return delivered;
    }

    /**
     * Payload of {@link EventType#ORDER_STATUS_CHANGED}.
     */
    public record StatusChange(String orderId, OrderStatus previousStatus, OrderStatus status,
                               Order order, Instant changedAt) {}
}
