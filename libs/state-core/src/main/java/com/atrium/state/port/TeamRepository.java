package com.atrium.state.port;

import com.atrium.state.account.AccountPatch;
import com.atrium.state.account.TeamDraft;
import com.atrium.state.identity.Team;

/** {@code listByScope(principal:u1)} returns the teams u1 is a member of. */
public interface TeamRepository extends EntityRepository<Team, TeamDraft, AccountPatch> {
}
