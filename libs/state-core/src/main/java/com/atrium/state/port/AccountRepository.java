package com.atrium.state.port;

import com.atrium.state.account.AccountPatch;
import com.atrium.state.account.OrganizationDraft;
import com.atrium.state.identity.Identity;

/**
 * Users and organizations. {@code listByScope(principal:u1)} returns u1's own user plus every
 * organization u1 belongs to.
 */
public interface AccountRepository extends EntityRepository<Identity, OrganizationDraft, AccountPatch> {
}
