package com.atrium.state.membership;

import com.atrium.permissions.Role;
import com.atrium.state.identity.IdentityType;

/** An invitation; the membership starts as INVITED. */
public record MembershipDraft(
        String workspaceId,
        String identityId,
        IdentityType identityType,
        String email,
        String displayName,
        Role role,
        String invitedBy
) {
}
