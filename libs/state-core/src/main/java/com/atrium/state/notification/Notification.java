package com.atrium.state.notification;

import com.atrium.state.store.Entity;
import java.time.Instant;

/**
 * A message to one principal.
 *
 * @param workspaceId workspace it concerns, or null for account-level notices
 */
public record Notification(
        String id,
        String recipientId,
        String workspaceId,
        NotificationType type,
        NotificationPriority priority,
        String title,
        String message,
        boolean read,
        Instant readAt,
        Instant createdAt
) implements Entity {

    public Notification {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (recipientId == null || recipientId.isBlank()) {
            throw new IllegalArgumentException("recipientId must not be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        priority = priority == null ? NotificationPriority.NORMAL : priority;
    }

    public Notification markedRead(Instant at) {
        return new Notification(id, recipientId, workspaceId, type, priority, title, message, true, at, createdAt);
    }
}
