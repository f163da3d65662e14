package com.atrium.state.notification;

public enum NotificationPriority {
    LOW,
    NORMAL,
    HIGH,
    URGENT
}
