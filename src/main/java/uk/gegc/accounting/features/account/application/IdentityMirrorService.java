package uk.gegc.accounting.features.account.application;

import uk.gegc.accounting.features.account.api.dto.CreateUserAccountRequest;
import uk.gegc.accounting.features.account.api.dto.UserAccountDto;
import uk.gegc.accounting.features.account.domain.model.AccountRole;
import uk.gegc.accounting.features.account.domain.model.UserAccount;

/**
 * Keeps a local record for every externally authenticated subject.
 */
public interface IdentityMirrorService {

    /**
     * Idempotent upsert from verified identity claims. Existing accounts are refreshed with the
     * latest username, email and role; absent accounts are created.
     */
    UserAccount ensureUser(String userId, String username, String email, AccountRole role);

    /**
     * Creates a bare ENDUSER account for an explicit subject id when none exists yet.
     * Never touches the attributes of an existing account.
     */
    UserAccount ensureAccountExists(String userId);

    /**
     * Resolves an account by id, email or username.
     *
     * @throws uk.gegc.accounting.features.account.domain.exception.UserNotFoundException when nothing matches
     * @throws uk.gegc.accounting.features.account.domain.exception.IdentityIntegrityException when the identifier matches several accounts
     */
    UserAccount resolveUser(String identifier);

    UserAccountDto createAccount(CreateUserAccountRequest request);
}
