package com.atrium.permissions;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("Role")
class RoleTest {

    @Nested
    @DisplayName("default capability tables")
    class Defaults {

        @Test
        @DisplayName("OWNER holds all 24 capabilities")
        void ownerHasEverything() {
            assertThat(Capability.values()).hasSize(24);
            assertThat(Role.OWNER.defaultCapabilities()).containsExactlyInAnyOrder(Capability.values());
        }

        @Test
        @DisplayName("ADMIN holds everything except workspace.delete")
        void adminLacksWorkspaceDelete() {
            assertThat(Role.ADMIN.defaultCapabilities())
                    .hasSize(23)
                    .doesNotContain(Capability.WORKSPACE_DELETE);
        }

        @Test
        @DisplayName("MEMBER can create and edit documents but not delete them")
        void memberDocuments() {
            assertThat(Role.MEMBER.defaultCapabilities())
                    .hasSize(11)
                    .contains(Capability.DOCUMENTS_CREATE, Capability.DOCUMENTS_EDIT,
                            Capability.DOCUMENTS_SHARE, Capability.TASKS_ASSIGN)
                    .doesNotContain(Capability.DOCUMENTS_DELETE, Capability.MEMBERS_INVITE,
                            Capability.SETTINGS_EDIT);
        }

        @Test
        @DisplayName("GUEST is read-only")
        void guestReadOnly() {
            assertThat(Role.GUEST.defaultCapabilities()).containsExactlyInAnyOrder(
                    Capability.WORKSPACE_VIEW, Capability.MEMBERS_VIEW, Capability.DOCUMENTS_VIEW,
                    Capability.TASKS_VIEW, Capability.SETTINGS_VIEW);
        }

        @ParameterizedTest
        @EnumSource(Role.class)
        @DisplayName("each role's defaults include every lower role's defaults")
        void monotonic(Role role) {
            for (Role lower : Role.values()) {
                if (role.implies(lower)) {
                    assertThat(role.defaultCapabilities()).containsAll(lower.defaultCapabilities());
                }
            }
        }
    }

    @Nested
    @DisplayName("hierarchy")
    class Hierarchy {

        @Test
        @DisplayName("OWNER implies every role")
        void ownerImpliesAll() {
            for (Role role : Role.values()) {
                assertThat(Role.OWNER.implies(role)).isTrue();
            }
        }

        @Test
        @DisplayName("MEMBER implies GUEST but not ADMIN")
        void memberRank() {
            assertThat(Role.MEMBER.implies(Role.GUEST)).isTrue();
            assertThat(Role.MEMBER.implies(Role.MEMBER)).isTrue();
            assertThat(Role.MEMBER.implies(Role.ADMIN)).isFalse();
        }
    }

    @Test
    @DisplayName("fromString() matches the stored value")
    void fromString() {
        assertThat(Role.fromString("admin")).contains(Role.ADMIN);
        assertThat(Role.fromString("ADMIN")).isEmpty();
    }
}
