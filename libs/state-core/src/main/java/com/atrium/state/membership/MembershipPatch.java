package com.atrium.state.membership;

import com.atrium.permissions.Role;
import java.util.List;

/** Partial update; null fields are left unchanged. */
public record MembershipPatch(Role role, MembershipStatus status, List<String> customPermissions) {

    public static MembershipPatch role(Role role) {
        return new MembershipPatch(role, null, null);
    }

    public static MembershipPatch status(MembershipStatus status) {
        return new MembershipPatch(null, status, null);
    }

    public static MembershipPatch customPermissions(List<String> customPermissions) {
        return new MembershipPatch(null, null, customPermissions);
    }

    public Membership applyTo(Membership membership) {
        Membership result = membership;
        if (role != null) {
            result = result.withRole(role);
        }
        if (status != null) {
            result = result.withStatus(status);
        }
        if (customPermissions != null) {
            result = result.withCustomPermissions(customPermissions);
        }
        return result;
    }
}
