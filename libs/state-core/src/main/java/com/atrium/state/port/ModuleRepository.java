package com.atrium.state.port;

import com.atrium.state.module.ModuleDraft;
import com.atrium.state.module.ModulePatch;
import com.atrium.state.module.WorkspaceModule;

/** Scope key {@code workspace:<id>}. */
public interface ModuleRepository extends EntityRepository<WorkspaceModule, ModuleDraft, ModulePatch> {
}
