package com.atrium.state.port;

import com.atrium.state.notification.Notification;
import com.atrium.state.notification.NotificationDraft;
import com.atrium.state.notification.NotificationPatch;

/** Scope key {@code principal:<id>} returns the principal's notifications. */
public interface NotificationRepository
        extends EntityRepository<Notification, NotificationDraft, NotificationPatch> {
}
