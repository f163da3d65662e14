package com.atrium.permissions;

import static com.atrium.permissions.Capability.*;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Workspace membership roles, ordered GUEST &lt; MEMBER &lt; ADMIN &lt; OWNER.
 *
 * <p>Each role carries a fixed default capability set. A higher role's set is a superset of every
 * lower role's set.
 */
public enum Role {

    GUEST("guest"),
    MEMBER("member"),
    ADMIN("admin"),
    OWNER("owner");

    private static final Set<Capability> GUEST_DEFAULTS = Collections.unmodifiableSet(EnumSet.of(
            WORKSPACE_VIEW, MEMBERS_VIEW, DOCUMENTS_VIEW, TASKS_VIEW, SETTINGS_VIEW));

    private static final Set<Capability> MEMBER_DEFAULTS = Collections.unmodifiableSet(EnumSet.of(
            WORKSPACE_VIEW, MEMBERS_VIEW,
            DOCUMENTS_VIEW, DOCUMENTS_CREATE, DOCUMENTS_EDIT, DOCUMENTS_SHARE,
            TASKS_VIEW, TASKS_CREATE, TASKS_EDIT, TASKS_ASSIGN,
            SETTINGS_VIEW));

    private static final Set<Capability> ADMIN_DEFAULTS = Collections.unmodifiableSet(
            EnumSet.complementOf(EnumSet.of(WORKSPACE_DELETE)));

    private static final Set<Capability> OWNER_DEFAULTS = Collections.unmodifiableSet(
            EnumSet.allOf(Capability.class));

    private final String value;

    Role(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /** Capabilities every holder of this role has, before custom grants. */
    public Set<Capability> defaultCapabilities() {
        return switch (this) {
            case GUEST -> GUEST_DEFAULTS;
            case MEMBER -> MEMBER_DEFAULTS;
            case ADMIN -> ADMIN_DEFAULTS;
            case OWNER -> OWNER_DEFAULTS;
        };
    }

    /** True when this role is the given role or ranks above it. */
    public boolean implies(Role other) {
        return compareTo(other) >= 0;
    }

    public static Optional<Role> fromString(String value) {
        for (Role role : values()) {
            if (role.value.equals(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
