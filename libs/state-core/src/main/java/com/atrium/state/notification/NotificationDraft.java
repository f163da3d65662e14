package com.atrium.state.notification;

public record NotificationDraft(
        String recipientId,
        String workspaceId,
        NotificationType type,
        NotificationPriority priority,
        String title,
        String message
) {
}
