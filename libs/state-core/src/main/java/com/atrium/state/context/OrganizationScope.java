package com.atrium.state.context;

public record OrganizationScope(String organizationId) implements Scope {

    public OrganizationScope {
        if (organizationId == null || organizationId.isBlank()) {
            throw new IllegalArgumentException("organizationId must not be null or blank");
        }
    }

    @Override
    public ScopeType type() {
        return ScopeType.ORGANIZATION;
    }

    @Override
    public String id() {
        return organizationId;
    }
}
