package com.ybds.domain.common;

import java.util.Locale;

/**
 * Event types pushed to connected clients.
 */
public enum EventType {
    // ═══════════════════════════════════════════════════════════════
    // ORDERS
    // ═══════════════════════════════════════════════════════════════

    ORDER_CREATED,
    ORDER_STATUS_CHANGED,

    // ═══════════════════════════════════════════════════════════════
    // CATALOG
    // ═══════════════════════════════════════════════════════════════

    PRODUCT_UPDATED,
    INVENTORY_LOW,

    // ═══════════════════════════════════════════════════════════════
    // USERS & SYSTEM
    // ═══════════════════════════════════════════════════════════════

    NOTIFICATION,
    SYSTEM_STATUS;

    /**
     * Value of the {@code type} field on the wire, e.g. {@code order_status_changed}.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
