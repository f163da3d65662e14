package com.atrium.state.workspace;

public enum WorkspaceVisibility {
    PRIVATE,
    INTERNAL,
    PUBLIC
}
