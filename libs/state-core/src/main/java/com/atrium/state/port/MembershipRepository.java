package com.atrium.state.port;

import com.atrium.state.membership.Membership;
import com.atrium.state.membership.MembershipDraft;
import com.atrium.state.membership.MembershipPatch;

/** Scope key {@code workspace:<id>}. */
public interface MembershipRepository extends EntityRepository<Membership, MembershipDraft, MembershipPatch> {
}
