package com.atrium.state.store;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A named set of entity ids kept next to the primary cache (starred documents, favourite
 * workspaces).
 *
 * <p>Owned by an {@link EntityStore}: removing an entity removes its id from every index, and a
 * rolled-back delete puts it back.
 */
public final class StoreIndex {

    private final String name;
    private final Set<String> ids = new LinkedHashSet<>();

    StoreIndex(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public boolean contains(String id) {
        return ids.contains(id);
    }

    public Set<String> ids() {
        return Collections.unmodifiableSet(ids);
    }

    public int size() {
        return ids.size();
    }

    boolean add(String id) {
        return ids.add(id);
    }

    boolean remove(String id) {
        return ids.remove(id);
    }

    void retainAll(Set<String> keep) {
        ids.retainAll(keep);
    }

    void clear() {
        ids.clear();
    }
}
