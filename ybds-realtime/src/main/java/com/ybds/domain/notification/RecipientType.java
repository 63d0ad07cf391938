package com.ybds.domain.notification;

public enum RecipientType {
    USER,
    GUEST,
    POTENTIAL_CUSTOMER,
    PARTNER,
    OTHER
}
