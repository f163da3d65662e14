package com.atrium.state.identity;

import com.atrium.state.store.Entity;

/**
 * An account the signed-in principal can act as, or that can hold a workspace membership.
 *
 * <p>Closed over the five identity kinds; switches over implementations are exhaustive.
 */
public sealed interface Identity extends Entity permits User, Organization, Bot, Team, Partner {

    IdentityType type();

    String displayName();

    /** Same identity with another display name. */
    Identity withDisplayName(String displayName);

    default boolean canOwnWorkspace() {
        return type().canOwnWorkspace();
    }
}
