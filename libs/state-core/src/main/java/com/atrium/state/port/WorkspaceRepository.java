package com.atrium.state.port;

import com.atrium.state.workspace.Workspace;
import com.atrium.state.workspace.WorkspaceDraft;
import com.atrium.state.workspace.WorkspacePatch;

/**
 * Scope keys: {@code user:<id>} and {@code organization:<id>} return owned workspaces;
 * {@code team:<id>} and {@code partner:<id>} return the workspaces the account was granted.
 */
public interface WorkspaceRepository extends EntityRepository<Workspace, WorkspaceDraft, WorkspacePatch> {
}
