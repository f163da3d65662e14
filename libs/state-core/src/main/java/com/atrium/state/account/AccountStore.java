package com.atrium.state.account;

import com.atrium.state.app.AppContext;
import com.atrium.state.context.ActiveContext;
import com.atrium.state.context.ContextStore;
import com.atrium.state.context.Scope;
import com.atrium.state.events.SessionEvents;
import com.atrium.state.identity.Identity;
import com.atrium.state.identity.IdentityType;
import com.atrium.state.identity.Organization;
import com.atrium.state.identity.Partner;
import com.atrium.state.identity.Team;
import com.atrium.state.identity.User;
import com.atrium.state.store.MutationGuard;
import com.atrium.state.store.ScopeKey;
import com.atrium.state.store.ScopedStore;
import com.atrium.state.store.StoreError;
import com.atrium.state.store.StoreResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The identities the signed-in principal can act as: their own user, the organizations they belong
 * to, and the teams and partner accounts they are a member of.
 *
 * <p>Keyed by principal, so switching between these identities never reloads the list.
 */
public final class AccountStore extends ScopedStore<Identity> {

    private static final Logger log = LoggerFactory.getLogger(AccountStore.class);
    private static final String SOURCE = "account-store";

    public AccountStore(AppContext app, ContextStore context) {
        super(app, context, "accounts");
        followCurrentContext();
    }

    @Override
    protected ScopeKey scopeFor(ActiveContext active) {
        return ScopeKey.principal(active.principalId());
    }

    @Override
    protected CompletableFuture<List<Identity>> fetch(ScopeKey key) {
        CompletableFuture<List<Identity>> accounts = app.accounts().listByScope(key);
        CompletableFuture<List<Team>> teams = app.teams().listByScope(key);
        CompletableFuture<List<Partner>> partners = app.partners().listByScope(key);
        return accounts
                .thenCombine(teams, AccountStore::concat)
                .thenCombine(partners, AccountStore::concat);
    }

    // ---------------------------------------------------------------- views

    /** The principal's own user account. */
    public Optional<User> personalAccount() {
        return context.current()
                .flatMap(active -> entities.get(active.principalId()))
                .filter(User.class::isInstance)
                .map(User.class::cast);
    }

    public List<Organization> organizations() {
        return ofType(Organization.class);
    }

    public List<Team> teams() {
        return ofType(Team.class);
    }

    public List<Partner> partners() {
        return ofType(Partner.class);
    }

    public List<Identity> byType(IdentityType type) {
        return entities.filter(identity -> identity.type() == type);
    }

    /** Teams and partner accounts of one organization. */
    public List<Identity> accountsOf(String organizationId) {
        return entities.filter(identity -> organizationId.equals(organizationOf(identity)));
    }

    /** Every cached identity the principal can act as, in cache order. Bots are excluded. */
    public List<Scope> availableScopes() {
        return entities.filter(identity -> identity.type() != IdentityType.BOT).stream()
                .map(Scope::of)
                .collect(Collectors.toList());
    }

    /** The cached identity the session currently acts as. */
    public Optional<Identity> currentAccount() {
        return context.currentScopeId().flatMap(entities::get);
    }

    // ---------------------------------------------------------------- operations

    /**
     * Asks the context store to act as the given cached identity.
     *
     * @return the selected scope, NOT_FOUND for an unknown id, VALIDATION for a bot
     */
    public StoreResult<Scope> selectAccount(String identityId) {
        Optional<Identity> identity = entities.get(identityId);
        if (identity.isEmpty()) {
            return StoreResult.failure(StoreError.notFound(identityId));
        }
        if (identity.get().type() == IdentityType.BOT) {
            return StoreResult.failure(StoreError.validation("a bot cannot be selected as an account"));
        }
        Scope scope = Scope.of(identity.get());
        log.debug("Selecting {} {}", scope.type().value(), scope.id());
        app.bus().publish(SessionEvents.ACCOUNT_SELECTED, SOURCE, scope);
        return StoreResult.success(scope);
    }

    /** Creates an organization owned by the principal. */
    public CompletableFuture<StoreResult<Identity>> createOrganization(OrganizationDraft draft) {
        MutationGuard guard = MutationGuard.require(() -> draft != null, "organization must not be null")
                .then(MutationGuard.require(() -> hasText(draft.displayName()), "displayName must not be blank"))
                .then(MutationGuard.require(() -> hasText(draft.createdBy()), "createdBy must not be blank"));
        return entities.create(guard,
                tempId -> new Organization(tempId, draft.displayName(), draft.description(),
                        Set.of(draft.createdBy()), Set.of(draft.createdBy()), draft.createdBy(),
                        app.clock().instant(), true),
                () -> app.accounts().create(draft));
    }

    /**
     * Renames a cached identity. A user may rename only themselves and an organization only its
     * owners; team and partner accounts need an owner of their organization.
     */
    public CompletableFuture<StoreResult<Identity>> rename(String identityId, String displayName) {
        MutationGuard guard = MutationGuard.require(() -> hasText(displayName), "displayName must not be blank")
                .then(() -> entities.get(identityId)
                        .filter(identity -> !mayRename(identity))
                        .map(identity -> StoreError.permissionDenied(
                                "principal may not rename " + identity.type().value() + " " + identityId)));
        AccountPatch patch = new AccountPatch(displayName);
        return entities.update(guard, identityId, patch::applyTo, () -> persistRename(identityId, patch));
    }

    private CompletableFuture<Void> persistRename(String identityId, AccountPatch patch) {
        IdentityType type = entities.get(identityId).map(Identity::type).orElse(IdentityType.USER);
        return switch (type) {
            case TEAM -> app.teams().update(identityId, patch);
            case PARTNER -> app.partners().update(identityId, patch);
            case USER, ORGANIZATION, BOT -> app.accounts().update(identityId, patch);
        };
    }

    private boolean mayRename(Identity identity) {
        String principal = context.current().map(ActiveContext::principalId).orElse(null);
        if (principal == null) {
            return false;
        }
        return switch (identity.type()) {
            case USER -> identity.id().equals(principal);
            case ORGANIZATION -> ((Organization) identity).isOwner(principal);
            case TEAM, PARTNER -> entities.get(organizationOf(identity))
                    .filter(Organization.class::isInstance)
                    .map(org -> ((Organization) org).isOwner(principal))
                    .orElse(false);
            case BOT -> false;
        };
    }

    private static String organizationOf(Identity identity) {
        if (identity instanceof Team team) {
            return team.organizationId();
        }
        if (identity instanceof Partner partner) {
            return partner.organizationId();
        }
        return null;
    }

    private <T extends Identity> List<T> ofType(Class<T> type) {
        return entities.filter(type::isInstance).stream().map(type::cast).collect(Collectors.toList());
    }

    private static List<Identity> concat(List<? extends Identity> first, List<? extends Identity> second) {
        List<Identity> result = new ArrayList<>(first.size() + second.size());
        result.addAll(first);
        result.addAll(second);
        return result;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
