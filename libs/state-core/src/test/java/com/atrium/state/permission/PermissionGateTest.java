package com.atrium.state.permission;

import static org.assertj.core.api.Assertions.assertThat;

import com.atrium.permissions.Capability;
import com.atrium.permissions.Role;
import com.atrium.state.membership.Membership;
import com.atrium.state.membership.MembershipStatus;
import com.atrium.state.store.ErrorKind;
import com.atrium.state.store.MutationGuard;
import com.atrium.state.store.StoreError;
import com.atrium.state.testing.TestMemberships;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PermissionGateTest {

    private final AtomicReference<Membership> current = new AtomicReference<>();
    private final PermissionGate gate = new PermissionGate(() -> Optional.ofNullable(current.get()));

    @Test
    @DisplayName("role defaults decide without custom grants")
    void roleDefaults() {
        current.set(TestMemberships.active("w1", "u1", Role.MEMBER));

        assertThat(gate.allows(Capability.DOCUMENTS_EDIT)).isTrue();
        assertThat(gate.allows(Capability.DOCUMENTS_DELETE)).isFalse();
    }

    @Test
    @DisplayName("custom grants add to the role")
    void customGrants() {
        current.set(TestMemberships.withCustom("w1", "u1", Role.GUEST, List.of("documents.delete")));

        assertThat(gate.allows(Capability.DOCUMENTS_DELETE)).isTrue();
        assertThat(gate.capabilities()).contains(Capability.DOCUMENTS_VIEW, Capability.DOCUMENTS_DELETE);
    }

    @Test
    @DisplayName("a suspended membership grants nothing")
    void suspended() {
        current.set(TestMemberships.membership("w1", "u1", Role.ADMIN, MembershipStatus.SUSPENDED, List.of()));

        assertThat(gate.allows(Capability.WORKSPACE_VIEW)).isFalse();
        assertThat(gate.capabilities()).isEmpty();
    }

    @Test
    @DisplayName("the workspace-bound check ignores memberships of other workspaces")
    void workspaceBound() {
        current.set(TestMemberships.active("w1", "u1", Role.OWNER));

        assertThat(gate.allows("w1", Capability.WORKSPACE_DELETE)).isTrue();
        assertThat(gate.allows("w2", Capability.WORKSPACE_DELETE)).isFalse();
    }

    @Test
    @DisplayName("guards read the membership when they run")
    void guardsAreLive() {
        MutationGuard guard = gate.require(Capability.MEMBERS_INVITE);
        current.set(TestMemberships.active("w1", "u1", Role.MEMBER));

        Optional<StoreError> denied = guard.check();
        current.set(TestMemberships.active("w1", "u1", Role.ADMIN));

        assertThat(denied).hasValueSatisfying(error -> {
            assertThat(error.kind()).isEqualTo(ErrorKind.PERMISSION_DENIED);
            assertThat(error.message()).isEqualTo("missing capability members.invite");
        });
        assertThat(guard.check()).isEmpty();
    }

    @Test
    @DisplayName("denyAll denies everything")
    void denyAll() {
        var closed = PermissionGate.denyAll();

        assertThat(closed.allows(Capability.WORKSPACE_VIEW)).isFalse();
        assertThat(closed.require(Capability.WORKSPACE_VIEW).check()).isPresent();
    }
}
