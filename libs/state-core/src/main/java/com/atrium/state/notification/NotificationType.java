package com.atrium.state.notification;

public enum NotificationType {
    INVITATION,
    MENTION,
    ASSIGNMENT,
    COMMENT,
    SYSTEM
}
