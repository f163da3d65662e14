package com.atrium.state.notification;

import com.atrium.state.app.AppContext;
import com.atrium.state.context.ActiveContext;
import com.atrium.state.context.ContextStore;
import com.atrium.state.store.MutationGuard;
import com.atrium.state.store.ScopeKey;
import com.atrium.state.store.ScopedStore;
import com.atrium.state.store.StoreResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * The signed-in principal's notifications. Keyed by principal, so they survive identity and
 * workspace switches. A principal may always act on their own notifications.
 */
public final class NotificationStore extends ScopedStore<Notification> {

    public NotificationStore(AppContext app, ContextStore context) {
        super(app, context, "notifications");
        followCurrentContext();
    }

    @Override
    protected ScopeKey scopeFor(ActiveContext active) {
        return ScopeKey.principal(active.principalId());
    }

    @Override
    protected CompletableFuture<List<Notification>> fetch(ScopeKey key) {
        return app.notifications().listByScope(key);
    }

    public List<Notification> unread() {
        return entities.filter(notification -> !notification.read());
    }

    public int unreadCount() {
        return unread().size();
    }

    public List<Notification> byType(NotificationType type) {
        return entities.filter(notification -> notification.type() == type);
    }

    public List<Notification> byPriority(NotificationPriority priority) {
        return entities.filter(notification -> notification.priority() == priority);
    }

    public List<Notification> forWorkspace(String workspaceId) {
        return entities.filter(notification -> Objects.equals(notification.workspaceId(), workspaceId));
    }

    /** Marking an already read notification succeeds without a repository call. */
    public CompletableFuture<StoreResult<Notification>> markAsRead(String notificationId) {
        boolean alreadyRead = entities.get(notificationId).map(Notification::read).orElse(false);
        if (alreadyRead) {
            return CompletableFuture.completedFuture(StoreResult.success(entities.get(notificationId).get()));
        }
        NotificationPatch patch = NotificationPatch.markRead(app.clock().instant());
        return entities.update(MutationGuard.allowAll(), notificationId, patch::applyTo,
                () -> app.notifications().update(notificationId, patch));
    }

    /**
     * Marks every unread notification read, one repository call each.
     *
     * @return the number of notifications that were marked
     */
    public CompletableFuture<StoreResult<Integer>> markAllAsRead() {
        Instant now = app.clock().instant();
        NotificationPatch patch = NotificationPatch.markRead(now);
        List<CompletableFuture<StoreResult<Notification>>> pending = new ArrayList<>();
        for (Notification notification : unread()) {
            String id = notification.id();
            pending.add(entities.update(MutationGuard.allowAll(), id, patch::applyTo,
                    () -> app.notifications().update(id, patch)));
        }
        return CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    int marked = 0;
                    for (CompletableFuture<StoreResult<Notification>> future : pending) {
                        StoreResult<Notification> result = future.join();
                        if (result.isFailure()) {
                            return StoreResult.<Integer>failure(result.error());
                        }
                        marked++;
                    }
                    return StoreResult.success(marked);
                });
    }

    public CompletableFuture<StoreResult<Void>> delete(String notificationId) {
        return entities.delete(MutationGuard.allowAll(), notificationId,
                () -> app.notifications().delete(notificationId));
    }
}
