package com.ybds.domain.order;

/**
 * Who placed an order. Only registered users can hold a live connection.
 */
public enum CustomerType {
    USER,
    GUEST
}
