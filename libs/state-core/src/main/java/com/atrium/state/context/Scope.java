package com.atrium.state.context;

import com.atrium.state.identity.Identity;
import com.atrium.state.identity.Partner;
import com.atrium.state.identity.Team;

/**
 * The identity a session acts as: the principal itself, or an organization, team or partner it
 * belongs to.
 */
public sealed interface Scope permits UserScope, OrganizationScope, TeamScope, PartnerScope {

    ScopeType type();

    /** Id of the identity acting. */
    String id();

    /** The organization behind this scope, or null for a personal scope. */
    String organizationId();

    /** Same type and id; two descriptors of one scope compare equal here. */
    default boolean sameAs(Scope other) {
        return other != null && type() == other.type() && id().equals(other.id());
    }

    /**
     * The scope that acts as the given identity.
     *
     * @throws IllegalArgumentException for bots, which cannot act as a scope
     */
    static Scope of(Identity identity) {
        return switch (identity.type()) {
            case USER -> new UserScope(identity.id());
            case ORGANIZATION -> new OrganizationScope(identity.id());
            case TEAM -> new TeamScope(identity.id(), ((Team) identity).organizationId());
            case PARTNER -> new PartnerScope(identity.id(), ((Partner) identity).organizationId());
            case BOT -> throw new IllegalArgumentException("bot " + identity.id() + " cannot act as a scope");
        };
    }

    /** Rebuilds a scope from its stored parts (see {@link ContextSnapshot}). */
    static Scope of(ScopeType type, String id, String organizationId) {
        return switch (type) {
            case USER -> new UserScope(id);
            case ORGANIZATION -> new OrganizationScope(id);
            case TEAM -> new TeamScope(id, organizationId);
            case PARTNER -> new PartnerScope(id, organizationId);
        };
    }
}
