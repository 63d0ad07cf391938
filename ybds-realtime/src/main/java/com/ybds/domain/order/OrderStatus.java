package com.ybds.domain.order;

/**
 * Order lifecycle states.
 */
public enum OrderStatus {
    PENDING_CONFIRMATION,
    CONFIRMED,
    SHIPMENT_REQUESTED,
    PACKING,
    SHIPPED,
    DELIVERED,
    RETURN_REQUESTED,
    RETURN_PROCESSING,
    RETURNED,
    CANCELED
}
