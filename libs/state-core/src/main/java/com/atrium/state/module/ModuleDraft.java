package com.atrium.state.module;

public record ModuleDraft(String workspaceId, ModuleType type, String name, int order) {
}
