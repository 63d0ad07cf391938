package com.ybds.service.notification;

import com.ybds.domain.common.EventType;
import com.ybds.domain.notification.Notification;
import com.ybds.domain.notification.RecipientType;
import com.ybds.service.core.EventService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Realtime channel for notifications.
 * USER notifications go to the recipient's connections; other recipient types are
 * broadcast, since they have no connection of their own. Notifications without a
 * recipient are not pushed.
 *
 * Entry point for the notification service outside this module, which calls
 * {@link #publish} once a notification is stored.
 */
public final class NotificationPublisher {
    private static final Logger log = LoggerFactory.getLogger(NotificationPublisher.class);

    private final EventService events;

    public NotificationPublisher(EventService events) {
        this.events = events;
    }

    public int publish(Notification notification) {
        if (!notification.hasRecipient()) {
            log.debug("Notification {} has no recipient, not pushed", notification.id());
            return 0;
        }
        if (notification.recipientType() == RecipientType.USER) {
            return events.emitUser(EventType.NOTIFICATION, notification.recipientId(), notification);
        }
        // TODO: route partner and potential-customer notifications to a dedicated topic instead of broadcasting
        return events.emitGlobal(EventType.NOTIFICATION, notification);
    }
}
