package com.atrium.state.module;

import com.atrium.permissions.Capability;
import com.atrium.state.app.AppContext;
import com.atrium.state.context.ActiveContext;
import com.atrium.state.context.ContextStore;
import com.atrium.state.permission.PermissionGate;
import com.atrium.state.store.ScopeKey;
import com.atrium.state.store.ScopedStore;
import com.atrium.state.store.StoreResult;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/** Feature modules of the open workspace. */
public final class ModuleStore extends ScopedStore<WorkspaceModule> {

    private static final Comparator<WorkspaceModule> BY_ORDER = Comparator.comparingInt(WorkspaceModule::order);

    private final PermissionGate gate;

    public ModuleStore(AppContext app, ContextStore context, PermissionGate gate) {
        super(app, context, "modules");
        if (gate == null) {
            throw new IllegalArgumentException("gate must not be null");
        }
        this.gate = gate;
        followCurrentContext();
    }

    @Override
    protected ScopeKey scopeFor(ActiveContext active) {
        return active.hasWorkspace() ? ScopeKey.workspace(active.workspaceId()) : null;
    }

    @Override
    protected CompletableFuture<List<WorkspaceModule>> fetch(ScopeKey key) {
        return app.modules().listByScope(key);
    }

    /** All modules in navigation order. */
    public List<WorkspaceModule> sorted() {
        return entities.all().stream().sorted(BY_ORDER).collect(Collectors.toList());
    }

    public List<WorkspaceModule> enabled() {
        return sorted().stream().filter(WorkspaceModule::enabled).collect(Collectors.toList());
    }

    /** Enabled modules a holder of the given capabilities may see, in navigation order. */
    public List<WorkspaceModule> visibleFor(Set<Capability> capabilities) {
        return enabled().stream()
                .filter(module -> capabilities.contains(module.requiredCapability()))
                .collect(Collectors.toList());
    }

    /** Enabled modules visible to the acting identity. */
    public List<WorkspaceModule> visible() {
        return visibleFor(gate.capabilities());
    }

    public Optional<WorkspaceModule> byType(ModuleType type) {
        return entities.filter(module -> module.type() == type).stream().findFirst();
    }

    public CompletableFuture<StoreResult<WorkspaceModule>> toggleEnabled(String moduleId) {
        return entities.updateWithValue(gate.require(Capability.SETTINGS_EDIT), moduleId,
                module -> module.withEnabled(!module.enabled()),
                applied -> app.modules().update(moduleId, new ModulePatch(applied.enabled(), null)));
    }
}
