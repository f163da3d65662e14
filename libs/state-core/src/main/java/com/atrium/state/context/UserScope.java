package com.atrium.state.context;

public record UserScope(String userId) implements Scope {

    public UserScope {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
    }

    @Override
    public ScopeType type() {
        return ScopeType.USER;
    }

    @Override
    public String id() {
        return userId;
    }

    @Override
    public String organizationId() {
        return null;
    }
}
