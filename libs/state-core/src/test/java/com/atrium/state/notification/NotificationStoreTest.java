package com.atrium.state.notification;

import static com.atrium.state.testing.TestIdentities.NOW;
import static com.atrium.state.testing.TestIdentities.user;
import static org.assertj.core.api.Assertions.assertThat;

import com.atrium.state.context.ContextStore;
import com.atrium.state.context.OrganizationScope;
import com.atrium.state.context.UserScope;
import com.atrium.state.store.ErrorKind;
import com.atrium.state.store.ScopeKey;
import com.atrium.state.testing.TestAppContexts;
import com.atrium.state.testing.TestAuthProvider;
import com.atrium.state.testing.TestRepositories;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("NotificationStore")
class NotificationStoreTest {

    private static final Instant READ_AT = Instant.parse("2024-04-30T08:00:00Z");

    private TestRepositories repos;
    private ContextStore context;
    private NotificationStore store;

    @BeforeEach
    void setUp() {
        repos = new TestRepositories();
        repos.notifications.seed(ScopeKey.principal("u1"),
                notification("n1", "w1", NotificationType.MENTION, NotificationPriority.HIGH, false),
                notification("n2", null, NotificationType.SYSTEM, NotificationPriority.LOW, true),
                notification("n3", "w1", NotificationType.ASSIGNMENT, NotificationPriority.HIGH, false));
        var app = TestAppContexts.create(repos, TestAuthProvider.signedInAs(user("u1")));
        context = new ContextStore(app);
        store = new NotificationStore(app, context);
        context.switchContext(new UserScope("u1"));
    }

    private static Notification notification(String id, String workspaceId, NotificationType type,
                                             NotificationPriority priority, boolean read) {
        return new Notification(id, "u1", workspaceId, type, priority, "Title " + id, "Message " + id, read,
                read ? READ_AT : null, NOW);
    }

    @Test
    @DisplayName("loads by principal and survives an identity switch")
    void keyedByPrincipal() {
        context.switchContext(new OrganizationScope("org1"));

        assertThat(repos.notifications.listedScopes()).containsExactly(ScopeKey.principal("u1"));
        assertThat(store.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("views filter by read flag, type, priority and workspace")
    void views() {
        assertThat(store.unread()).extracting(Notification::id).containsExactly("n1", "n3");
        assertThat(store.unreadCount()).isEqualTo(2);
        assertThat(store.byType(NotificationType.SYSTEM)).extracting(Notification::id).containsExactly("n2");
        assertThat(store.byPriority(NotificationPriority.HIGH)).hasSize(2);
        assertThat(store.forWorkspace("w1")).extracting(Notification::id).containsExactly("n1", "n3");
        assertThat(store.forWorkspace(null)).extracting(Notification::id).containsExactly("n2");
    }

    @Test
    @DisplayName("markAsRead stamps the clock time")
    void markAsRead() {
        var result = store.markAsRead("n1").join();

        assertThat(result.value().read()).isTrue();
        assertThat(result.value().readAt()).isEqualTo(NOW);
        assertThat(store.unreadCount()).isEqualTo(1);
        assertThat(repos.notifications.updateCalls()).isEqualTo(1);
    }

    @Test
    @DisplayName("markAsRead on a read notification makes no call")
    void markAsReadTwice() {
        var result = store.markAsRead("n2").join();

        assertThat(result.value().readAt()).isEqualTo(READ_AT);
        assertThat(repos.notifications.updateCalls()).isZero();
    }

    @Test
    @DisplayName("markAsRead rolls back when the repository fails")
    void markAsReadRollback() {
        repos.notifications.failNextCall(new IllegalStateException("offline"));

        var result = store.markAsRead("n1").join();

        assertThat(result.failedWith(ErrorKind.TRANSPORT)).isTrue();
        assertThat(store.get("n1")).map(Notification::read).contains(false);
    }

    @Test
    @DisplayName("markAllAsRead counts what it marked")
    void markAllAsRead() {
        var result = store.markAllAsRead().join();

        assertThat(result.value()).isEqualTo(2);
        assertThat(store.unread()).isEmpty();
        assertThat(repos.notifications.updateCalls()).isEqualTo(2);
    }

    @Test
    @DisplayName("markAllAsRead reports the first failure")
    void markAllAsReadFailure() {
        repos.notifications.failNextCall(new IllegalStateException("offline"));

        var result = store.markAllAsRead().join();

        assertThat(result.failedWith(ErrorKind.TRANSPORT)).isTrue();
        assertThat(store.unread()).extracting(Notification::id).containsExactly("n1");
    }

    @Test
    @DisplayName("delete removes the notification")
    void delete() {
        assertThat(store.delete("n2").join().isSuccess()).isTrue();

        assertThat(store.get("n2")).isEmpty();
        assertThat(repos.notifications.stored("n2")).isEmpty();
    }
}
