package com.atrium.state.module;

import com.atrium.permissions.Capability;

/** Feature modules a workspace can switch on. */
public enum ModuleType {

    OVERVIEW(Capability.WORKSPACE_VIEW),
    DOCUMENTS(Capability.DOCUMENTS_VIEW),
    TASKS(Capability.TASKS_VIEW),
    MEMBERS(Capability.MEMBERS_VIEW),
    PERMISSIONS(Capability.PERMISSIONS_VIEW),
    AUDIT(Capability.AUDIT_VIEW),
    SETTINGS(Capability.SETTINGS_VIEW),
    JOURNAL(Capability.WORKSPACE_VIEW);

    private final Capability viewCapability;

    ModuleType(Capability viewCapability) {
        this.viewCapability = viewCapability;
    }

    /** Capability a member needs to see the module. */
    public Capability viewCapability() {
        return viewCapability;
    }
}
