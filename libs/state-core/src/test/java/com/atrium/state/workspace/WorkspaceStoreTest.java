package com.atrium.state.workspace;

import static com.atrium.state.testing.TestIdentities.NOW;
import static com.atrium.state.testing.TestIdentities.user;
import static com.atrium.state.testing.TestIdentities.userWorkspace;
import static com.atrium.state.testing.TestIdentities.workspace;
import static org.assertj.core.api.Assertions.assertThat;

import com.atrium.eventbus.testing.RecordingEventHandler;
import com.atrium.permissions.Role;
import com.atrium.state.app.AppContext;
import com.atrium.state.context.ContextStore;
import com.atrium.state.context.OrganizationScope;
import com.atrium.state.context.TeamScope;
import com.atrium.state.context.UserScope;
import com.atrium.state.events.SessionEvents;
import com.atrium.state.identity.IdentityType;
import com.atrium.state.membership.MembershipStore;
import com.atrium.state.store.ErrorKind;
import com.atrium.state.store.ScopeKey;
import com.atrium.state.testing.TestAppContexts;
import com.atrium.state.testing.TestAuthProvider;
import com.atrium.state.testing.TestMemberships;
import com.atrium.state.testing.TestRepositories;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("WorkspaceStore")
class WorkspaceStoreTest {

    private static final ScopeKey USER_U1 = ScopeKey.of("user", "u1");
    private static final Instant EARLIER = Instant.parse("2024-04-01T00:00:00Z");
    private static final Instant LATER = Instant.parse("2024-04-20T00:00:00Z");

    private TestRepositories repos;
    private AppContext app;
    private ContextStore context;
    private WorkspaceStore store;

    @BeforeEach
    void setUp() {
        repos = new TestRepositories();
        app = TestAppContexts.create(repos, TestAuthProvider.signedInAs(user("u1")));
        context = new ContextStore(app);
        MembershipStore memberships = new MembershipStore(app, context);
        store = new WorkspaceStore(app, context, memberships.gate());
    }

    private WorkspaceDraft draft(String name, IdentityType ownerType, String ownerId) {
        return new WorkspaceDraft(name, "Display " + name, null, ownerType, ownerId, WorkspaceVisibility.PRIVATE, "u1");
    }

    @Nested
    @DisplayName("currentWorkspace()")
    class CurrentWorkspace {

        @Test
        @DisplayName("u1 signs in: the workspace list loads for u1 and the most recent one is current")
        void userScenario() {
            repos.workspaces.seed(USER_U1,
                    userWorkspace("w1", "u1", LATER),
                    userWorkspace("w2", "u1", EARLIER),
                    userWorkspace("w3", "u1", null));

            context.switchContext(new UserScope("u1"));

            assertThat(repos.workspaces.listedScopes()).containsExactly(USER_U1);
            assertThat(store.currentWorkspace()).map(Workspace::id).contains("w1");
        }

        @Test
        @DisplayName("is empty when the list is empty")
        void emptyList() {
            context.switchContext(new UserScope("u1"));

            assertThat(store.currentWorkspace()).isEmpty();
        }

        @Test
        @DisplayName("the selected workspace wins, without a reload")
        void selectedWins() {
            repos.workspaces.seed(USER_U1, userWorkspace("w1", "u1", LATER), userWorkspace("w2", "u1", EARLIER));
            context.switchContext(new UserScope("u1"));

            context.switchWorkspace("w2");

            assertThat(store.currentWorkspace()).map(Workspace::id).contains("w2");
            assertThat(repos.workspaces.listCalls()).isEqualTo(1);
        }

        @Test
        @DisplayName("a new identity scope reloads with its own key")
        void reloadsPerIdentity() {
            context.switchContext(new UserScope("u1"));

            context.switchContext(new TeamScope("t1", "org1"));

            assertThat(repos.workspaces.listedScopes()).containsExactly(USER_U1, ScopeKey.of("team", "t1"));
        }
    }

    @Nested
    @DisplayName("views")
    class Views {

        @BeforeEach
        void load() {
            Workspace archived = WorkspacePatch.status(WorkspaceStatus.ARCHIVED, NOW)
                    .applyTo(userWorkspace("w3", "u1", null));
            repos.workspaces.seed(USER_U1,
                    userWorkspace("w1", "u1", EARLIER),
                    userWorkspace("w2", "u1", LATER),
                    archived);
            context.switchContext(new UserScope("u1"));
        }

        @Test
        @DisplayName("recent lists accessed workspaces, most recent first")
        void recent() {
            assertThat(store.recentWorkspaces(5)).extracting(Workspace::id).containsExactly("w2", "w1");
            assertThat(store.recentWorkspaces(1)).extracting(Workspace::id).containsExactly("w2");
        }

        @Test
        @DisplayName("splits active from archived")
        void byStatus() {
            assertThat(store.activeWorkspaces()).extracting(Workspace::id).containsExactly("w1", "w2");
            assertThat(store.archivedWorkspaces()).extracting(Workspace::id).containsExactly("w3");
        }

        @Test
        @DisplayName("toggleFavorite flips membership in the favourites")
        void favorites() {
            assertThat(store.toggleFavorite("w1")).isTrue();
            assertThat(store.favoriteWorkspaces()).extracting(Workspace::id).containsExactly("w1");

            assertThat(store.toggleFavorite("w1")).isFalse();
            assertThat(store.favoriteWorkspaces()).isEmpty();
        }

        @Test
        @DisplayName("trackAccess stamps the clock time locally")
        void trackAccess() {
            assertThat(store.trackAccess("w1")).isTrue();

            assertThat(store.get("w1")).map(Workspace::lastAccessedAt).contains(NOW);
            assertThat(store.currentWorkspace()).map(Workspace::id).contains("w1");
            assertThat(repos.workspaces.updateCalls()).isZero();
        }
    }

    @Nested
    @DisplayName("create()")
    class Create {

        @Test
        @DisplayName("a user creates a workspace they own")
        void userCreates() {
            context.switchContext(new UserScope("u1"));

            var result = store.create(draft("my-project", IdentityType.USER, "u1")).join();

            assertThat(result.isSuccess()).isTrue();
            assertThat(store.all()).extracting(Workspace::name).containsExactly("my-project");
        }

        @Test
        @DisplayName("an organization creates a workspace it owns")
        void organizationCreates() {
            context.switchContext(new OrganizationScope("org1"));

            var result = store.create(draft("org-space", IdentityType.ORGANIZATION, "org1")).join();

            assertThat(result.isSuccess()).isTrue();
        }

        @Test
        @DisplayName("a team cannot own a workspace")
        void teamDenied() {
            context.switchContext(new TeamScope("t1", "org1"));

            var result = store.create(draft("team-space", IdentityType.ORGANIZATION, "org1")).join();

            assertThat(result.failedWith(ErrorKind.PERMISSION_DENIED)).isTrue();
            assertThat(repos.workspaces.createCalls()).isZero();
        }

        @Test
        @DisplayName("names follow the naming rules")
        void invalidName() {
            context.switchContext(new UserScope("u1"));

            assertThat(store.create(draft("no spaces", IdentityType.USER, "u1")).join()
                    .failedWith(ErrorKind.VALIDATION)).isTrue();
            assertThat(store.create(draft("", IdentityType.USER, "u1")).join()
                    .failedWith(ErrorKind.VALIDATION)).isTrue();
        }

        @Test
        @DisplayName("the owner must be the acting identity")
        void foreignOwner() {
            context.switchContext(new UserScope("u1"));

            var result = store.create(draft("x", IdentityType.USER, "u2")).join();

            assertThat(result.failedWith(ErrorKind.VALIDATION)).isTrue();
        }
    }

    @Nested
    @DisplayName("editing")
    class Editing {

        @Test
        @DisplayName("the owner renames without a membership")
        void ownerRenames() {
            repos.workspaces.seed(USER_U1, userWorkspace("w1", "u1", null));
            context.switchContext(new UserScope("u1"));

            var result = store.rename("w1", "Renamed").join();

            assertThat(result.value().displayName()).isEqualTo("Renamed");
            assertThat(repos.workspaces.updateCalls()).isEqualTo(1);
        }

        @Test
        @DisplayName("a granted workspace needs workspace.edit through the membership")
        void grantedNeedsCapability() {
            ScopeKey team = ScopeKey.of("team", "t1");
            repos.workspaces.seed(team, workspace("w5", IdentityType.ORGANIZATION, "org1", null));
            repos.memberships.seed(ScopeKey.workspace("w5"), TestMemberships.active("w5", "u1", Role.MEMBER));
            context.switchContext(new TeamScope("t1", "org1"), "w5");

            assertThat(store.rename("w5", "Nope").join().failedWith(ErrorKind.PERMISSION_DENIED)).isTrue();
            assertThat(store.archive("w5").join().failedWith(ErrorKind.PERMISSION_DENIED)).isTrue();
        }

        @Test
        @DisplayName("an admin of the open workspace archives it")
        void adminArchives() {
            ScopeKey team = ScopeKey.of("team", "t1");
            repos.workspaces.seed(team, workspace("w5", IdentityType.ORGANIZATION, "org1", null));
            repos.memberships.seed(ScopeKey.workspace("w5"), TestMemberships.active("w5", "u1", Role.ADMIN));
            context.switchContext(new TeamScope("t1", "org1"), "w5");

            assertThat(store.archive("w5").join().isSuccess()).isTrue();
            assertThat(store.archivedWorkspaces()).extracting(Workspace::id).containsExactly("w5");
        }

        @Test
        @DisplayName("delete publishes workspace.removed and the open workspace closes")
        void deleteClosesWorkspace() {
            var removed = new RecordingEventHandler<String>();
            app.bus().subscribe(SessionEvents.WORKSPACE_REMOVED, removed);
            repos.workspaces.seed(USER_U1, userWorkspace("w1", "u1", null));
            context.switchContext(new UserScope("u1"), "w1");
            store.toggleFavorite("w1");

            var result = store.delete("w1").join();

            assertThat(result.isSuccess()).isTrue();
            assertThat(removed.payloads()).containsExactly("w1");
            assertThat(context.hasWorkspace()).isFalse();
            assertThat(store.favoriteWorkspaces()).isEmpty();
        }

        @Test
        @DisplayName("a failed delete restores the workspace and publishes nothing")
        void failedDelete() {
            var removed = new RecordingEventHandler<String>();
            app.bus().subscribe(SessionEvents.WORKSPACE_REMOVED, removed);
            repos.workspaces.seed(USER_U1, userWorkspace("w1", "u1", null));
            context.switchContext(new UserScope("u1"));
            repos.workspaces.failNextCall(new IllegalStateException("backend down"));

            var result = store.delete("w1").join();

            assertThat(result.failedWith(ErrorKind.TRANSPORT)).isTrue();
            assertThat(store.get("w1")).isPresent();
            assertThat(removed.count()).isZero();
        }

        @Test
        @DisplayName("refresh drops a workspace deleted elsewhere")
        void refreshDropsMissing() {
            repos.workspaces.seed(USER_U1, userWorkspace("w1", "u1", null));
            context.switchContext(new UserScope("u1"));
            repos.workspaces.removeStored("w1");

            var result = store.refresh("w1").join();

            assertThat(result.failedWith(ErrorKind.NOT_FOUND)).isTrue();
            assertThat(store.get("w1")).isEmpty();
        }
    }
}
