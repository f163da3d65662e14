package com.atrium.state.port;

import com.atrium.state.account.AccountPatch;
import com.atrium.state.account.PartnerDraft;
import com.atrium.state.identity.Partner;

/** {@code listByScope(principal:u1)} returns the partner accounts u1 is a member of. */
public interface PartnerRepository extends EntityRepository<Partner, PartnerDraft, AccountPatch> {
}
