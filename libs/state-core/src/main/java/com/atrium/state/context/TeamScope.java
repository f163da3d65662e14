package com.atrium.state.context;

public record TeamScope(String teamId, String organizationId) implements Scope {

    public TeamScope {
        if (teamId == null || teamId.isBlank()) {
            throw new IllegalArgumentException("teamId must not be null or blank");
        }
        if (organizationId == null || organizationId.isBlank()) {
            throw new IllegalArgumentException("organizationId must not be null or blank");
        }
    }

    @Override
    public ScopeType type() {
        return ScopeType.TEAM;
    }

    @Override
    public String id() {
        return teamId;
    }
}
