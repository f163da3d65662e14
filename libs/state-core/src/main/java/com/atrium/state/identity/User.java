package com.atrium.state.identity;

import java.time.Instant;

/** A personal account; the only identity a principal signs in as. */
public record User(
        String id,
        String displayName,
        String email,
        Instant createdAt,
        boolean active
) implements Identity {

    public User {
        IdentityChecks.requireText(id, "id");
        IdentityChecks.requireText(displayName, "displayName");
    }

    @Override
    public IdentityType type() {
        return IdentityType.USER;
    }

    @Override
    public User withDisplayName(String displayName) {
        return new User(id, displayName, email, createdAt, active);
    }
}
