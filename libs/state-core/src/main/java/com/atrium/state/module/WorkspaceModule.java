package com.atrium.state.module;

import com.atrium.permissions.Capability;
import com.atrium.state.store.Entity;

/**
 * A feature toggle of one workspace.
 *
 * @param order              position in navigation, ascending
 * @param requiredCapability capability needed to see it; defaults to the type's view capability
 */
public record WorkspaceModule(
        String id,
        String workspaceId,
        ModuleType type,
        String name,
        int order,
        boolean enabled,
        Capability requiredCapability
) implements Entity {

    public WorkspaceModule {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        requiredCapability = requiredCapability == null ? type.viewCapability() : requiredCapability;
    }

    public WorkspaceModule withEnabled(boolean enabled) {
        return new WorkspaceModule(id, workspaceId, type, name, order, enabled, requiredCapability);
    }

    public WorkspaceModule withOrder(int order) {
        return new WorkspaceModule(id, workspaceId, type, name, order, enabled, requiredCapability);
    }
}
