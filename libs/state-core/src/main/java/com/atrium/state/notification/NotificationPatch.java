package com.atrium.state.notification;

import java.time.Instant;

/** The only mutable part of a notification is its read flag. */
public record NotificationPatch(boolean read, Instant readAt) {

    public static NotificationPatch markRead(Instant at) {
        return new NotificationPatch(true, at);
    }

    public Notification applyTo(Notification notification) {
        if (!read) {
            return new Notification(notification.id(), notification.recipientId(), notification.workspaceId(),
                    notification.type(), notification.priority(), notification.title(), notification.message(),
                    false, null, notification.createdAt());
        }
        return notification.markedRead(readAt);
    }
}
