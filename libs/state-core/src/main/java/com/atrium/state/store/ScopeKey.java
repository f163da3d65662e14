package com.atrium.state.store;

/**
 * Identifies the slice of remote data a store holds, e.g. "documents of workspace w1".
 *
 * @param kind what the id refers to (principal, workspace, organization, ...)
 * @param id   the scoping entity id
 */
public record ScopeKey(String kind, String id) {

    public static final String PRINCIPAL = "principal";
    public static final String WORKSPACE = "workspace";
    public static final String ORGANIZATION = "organization";
    public static final String CREATOR = "creator";

    public ScopeKey {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind must not be null or blank");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
    }

    public static ScopeKey of(String kind, String id) {
        return new ScopeKey(kind, id);
    }

    public static ScopeKey principal(String principalId) {
        return new ScopeKey(PRINCIPAL, principalId);
    }

    public static ScopeKey workspace(String workspaceId) {
        return new ScopeKey(WORKSPACE, workspaceId);
    }

    public static ScopeKey organization(String organizationId) {
        return new ScopeKey(ORGANIZATION, organizationId);
    }

    public static ScopeKey creator(String userId) {
        return new ScopeKey(CREATOR, userId);
    }

    @Override
    public String toString() {
        return kind + ":" + id;
    }
}
