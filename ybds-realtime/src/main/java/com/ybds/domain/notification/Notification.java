package com.ybds.domain.notification;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A notification addressed to one recipient. {@code recipientId} is null for
 * notifications that have no addressable recipient.
 */
public record Notification(
    String id,
    String recipientId,
    RecipientType recipientType,
    String title,
    String message,
    Map<String, Object> metadata,
    Instant createdAt
) {
    public Notification {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean hasRecipient() {
        return recipientId != null && !recipientId.isEmpty();
    }
}
