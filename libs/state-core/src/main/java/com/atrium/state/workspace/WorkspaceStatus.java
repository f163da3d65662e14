package com.atrium.state.workspace;

public enum WorkspaceStatus {
    ACTIVE,
    ARCHIVED,
    PENDING_DELETION
}
