package com.atrium.state.context;

public record PartnerScope(String partnerId, String organizationId) implements Scope {

    public PartnerScope {
        if (partnerId == null || partnerId.isBlank()) {
            throw new IllegalArgumentException("partnerId must not be null or blank");
        }
        if (organizationId == null || organizationId.isBlank()) {
            throw new IllegalArgumentException("organizationId must not be null or blank");
        }
    }

    @Override
    public ScopeType type() {
        return ScopeType.PARTNER;
    }

    @Override
    public String id() {
        return partnerId;
    }
}
