package com.atrium.permissions;

import java.util.Optional;

/**
 * A single thing a workspace member may do, named {@code area.action}.
 *
 * <p>The dotted value is what repositories store in a membership's custom permission list.
 */
public enum Capability {

    WORKSPACE_VIEW("workspace.view"),
    WORKSPACE_EDIT("workspace.edit"),
    WORKSPACE_DELETE("workspace.delete"),
    WORKSPACE_ADMIN("workspace.admin"),

    MEMBERS_VIEW("members.view"),
    MEMBERS_INVITE("members.invite"),
    MEMBERS_REMOVE("members.remove"),
    MEMBERS_MANAGE_ROLES("members.manage_roles"),

    DOCUMENTS_VIEW("documents.view"),
    DOCUMENTS_CREATE("documents.create"),
    DOCUMENTS_EDIT("documents.edit"),
    DOCUMENTS_DELETE("documents.delete"),
    DOCUMENTS_SHARE("documents.share"),

    TASKS_VIEW("tasks.view"),
    TASKS_CREATE("tasks.create"),
    TASKS_EDIT("tasks.edit"),
    TASKS_DELETE("tasks.delete"),
    TASKS_ASSIGN("tasks.assign"),

    SETTINGS_VIEW("settings.view"),
    SETTINGS_EDIT("settings.edit"),

    PERMISSIONS_VIEW("permissions.view"),
    PERMISSIONS_EDIT("permissions.edit"),

    AUDIT_VIEW("audit.view"),
    AUDIT_EXPORT("audit.export");

    private final String value;

    Capability(String value) {
        this.value = value;
    }

    /** The stored string form (e.g., "documents.edit"). */
    public String value() {
        return value;
    }

    /**
     * Looks up a capability by its stored string form.
     *
     * @return the matching capability, or empty for unknown strings
     */
    public static Optional<Capability> fromString(String value) {
        for (Capability capability : values()) {
            if (capability.value.equals(value)) {
                return Optional.of(capability);
            }
        }
        return Optional.empty();
    }

    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
