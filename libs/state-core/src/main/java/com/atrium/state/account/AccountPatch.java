package com.atrium.state.account;

import com.atrium.state.identity.Identity;

/** Partial update of any account; null fields are left unchanged. */
public record AccountPatch(String displayName) {

    public Identity applyTo(Identity identity) {
        return displayName == null ? identity : identity.withDisplayName(displayName);
    }
}
