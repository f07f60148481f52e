package uk.gegc.accounting.features.credit.application;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.accounting.features.account.domain.exception.UserNotFoundException;
import uk.gegc.accounting.features.account.domain.model.UserAccount;
import uk.gegc.accounting.features.account.infra.repository.UserAccountRepository;
import uk.gegc.accounting.shared.exception.ConcurrencyConflictException;

import java.util.Optional;

/**
 * Per-user mutual exclusion for ledger state.
 *
 * <p>Takes a row lock on the user's mirror account that is held until the surrounding transaction
 * ends. Every mutating ledger and session operation calls this before reading allocations, so
 * operations for one user are linearized while different users never contend.
 */
@Component
@RequiredArgsConstructor
public class UserLedgerLock {

    private final UserAccountRepository userAccountRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<UserAccount> lock(String userId) {
        try {
            return userAccountRepository.findByUserIdForUpdate(userId);
        } catch (PessimisticLockingFailureException e) {
            throw new ConcurrencyConflictException("Timed out waiting for the ledger of user " + userId, e);
        }
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public UserAccount lockExisting(String userId) {
        return lock(userId).orElseThrow(() -> new UserNotFoundException(userId));
    }
}
