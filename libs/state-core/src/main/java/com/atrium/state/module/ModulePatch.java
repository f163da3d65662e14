package com.atrium.state.module;

/** Partial update; null fields are left unchanged. */
public record ModulePatch(Boolean enabled, Integer order) {

    public WorkspaceModule applyTo(WorkspaceModule module) {
        WorkspaceModule result = module;
        if (enabled != null) {
            result = result.withEnabled(enabled);
        }
        if (order != null) {
            result = result.withOrder(order);
        }
        return result;
    }
}
