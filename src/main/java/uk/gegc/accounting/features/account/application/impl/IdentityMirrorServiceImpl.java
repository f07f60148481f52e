package uk.gegc.accounting.features.account.application.impl;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.accounting.features.account.api.dto.CreateUserAccountRequest;
import uk.gegc.accounting.features.account.api.dto.UserAccountDto;
import uk.gegc.accounting.features.account.application.IdentityMirrorService;
import uk.gegc.accounting.features.account.domain.exception.IdentityIntegrityException;
import uk.gegc.accounting.features.account.domain.exception.UserAlreadyExistsException;
import uk.gegc.accounting.features.account.domain.exception.UserNotFoundException;
import uk.gegc.accounting.features.account.domain.model.AccountRole;
import uk.gegc.accounting.features.account.domain.model.UserAccount;
import uk.gegc.accounting.features.account.infra.mapping.UserAccountMapper;
import uk.gegc.accounting.features.account.infra.repository.UserAccountRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

@Service
@RequiredArgsConstructor
public class IdentityMirrorServiceImpl implements IdentityMirrorService {

    private static final Logger log = LoggerFactory.getLogger(IdentityMirrorServiceImpl.class);

    private final UserAccountRepository userAccountRepository;
    private final UserAccountMapper userAccountMapper;
    private final PlatformTransactionManager transactionManager;
    private final Clock clock;

    @Override
    public UserAccount ensureUser(String userId, String username, String email, AccountRole role) {
        requireUserId(userId);
        AccountRole effectiveRole = role != null ? role : AccountRole.ENDUSER;
        String normalizedEmail = normalizeEmail(email);
        String normalizedUsername = normalizeUsername(username);

        TransactionTemplate tx = requiresNew();
        try {
            return tx.execute(status -> upsert(userId, normalizedUsername, normalizedEmail, effectiveRole));
        } catch (DataIntegrityViolationException e) {
            // Lost an insert race for the same subject; the second pass finds the winner's row
            log.info("Concurrent first contact for user {}, retrying upsert", userId);
            return tx.execute(status -> upsert(userId, normalizedUsername, normalizedEmail, effectiveRole));
        }
    }

    @Override
    public UserAccount ensureAccountExists(String userId) {
        requireUserId(userId);
        TransactionTemplate tx = requiresNew();
        try {
            return tx.execute(status -> userAccountRepository.findById(userId)
                    .orElseGet(() -> insertPlaceholder(userId)));
        } catch (DataIntegrityViolationException e) {
            log.info("Account {} was created concurrently, re-reading", userId);
            return tx.execute(status -> userAccountRepository.findById(userId)
                    .orElseThrow(() -> new UserNotFoundException(userId)));
        }
    }

    @Override
    @Transactional(readOnly = true)
    public UserAccount resolveUser(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new UserNotFoundException(String.valueOf(identifier));
        }
        String trimmed = identifier.trim();

        Map<String, UserAccount> matches = new LinkedHashMap<>();
        userAccountRepository.findById(trimmed).ifPresent(u -> matches.put(u.getUserId(), u));
        userAccountRepository.findByEmail(trimmed.toLowerCase(Locale.ROOT)).ifPresent(u -> matches.put(u.getUserId(), u));
        userAccountRepository.findByUsername(trimmed).ifPresent(u -> matches.put(u.getUserId(), u));

        if (matches.isEmpty()) {
            throw new UserNotFoundException(trimmed);
        }
        if (matches.size() > 1) {
            log.error("Identifier '{}' resolves to {} accounts: {}", trimmed, matches.size(), matches.keySet());
            throw new IdentityIntegrityException("Identifier resolves to more than one account");
        }
        return matches.values().iterator().next();
    }

    @Override
    @Transactional
    public UserAccountDto createAccount(CreateUserAccountRequest request) {
        String email = normalizeEmail(request.email());
        String username = normalizeUsername(request.username());

        if (userAccountRepository.existsById(request.userId())) {
            throw new UserAlreadyExistsException("Account already exists for user id " + request.userId());
        }
        if (userAccountRepository.existsByUsername(username)) {
            throw new UserAlreadyExistsException("Username is already taken: " + username);
        }
        if (userAccountRepository.existsByEmail(email)) {
            throw new UserAlreadyExistsException("Email is already registered: " + email);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        UserAccount account = new UserAccount();
        account.setUserId(request.userId());
        account.setUsername(username);
        account.setEmail(email);
        account.setRole(request.role());
        account.setCreatedAt(now);
        account.setUpdatedAt(now);
        UserAccount saved = userAccountRepository.save(account);

        log.info("Provisioned account {} ({}) with role {}", saved.getUserId(), username, saved.getRole());
        return userAccountMapper.toDto(saved);
    }

    private UserAccount upsert(String userId, String username, String email, AccountRole role) {
        LocalDateTime now = LocalDateTime.now(clock);
        UserAccount account = userAccountRepository.findById(userId).orElse(null);

        if (account == null) {
            releaseAttributesHeldByOthers(userId, username, email, now);
            account = new UserAccount();
            account.setUserId(userId);
            account.setUsername(username);
            account.setEmail(email);
            account.setRole(role);
            account.setCreatedAt(now);
            account.setUpdatedAt(now);
            log.info("Created mirror account for user {} with role {}", userId, role);
            return userAccountRepository.saveAndFlush(account);
        }

        boolean changed = !Objects.equals(account.getUsername(), username)
                || !Objects.equals(account.getEmail(), email)
                || account.getRole() != role;
        if (!changed) {
            return account;
        }

        releaseAttributesHeldByOthers(userId, username, email, now);
        if (account.getRole() != role) {
            log.info("Role of user {} changed from {} to {}", userId, account.getRole(), role);
        }
        account.setUsername(username);
        account.setEmail(email);
        account.setRole(role);
        account.setUpdatedAt(now);
        return userAccountRepository.saveAndFlush(account);
    }

    /**
     * The latest claim is authoritative: a username or email now carried by {@code userId}
     * is cleared from whichever other account still holds it.
     */
    private void releaseAttributesHeldByOthers(String userId, String username, String email, LocalDateTime now) {
        if (username != null) {
            userAccountRepository.findByUsername(username)
                    .filter(other -> !other.getUserId().equals(userId))
                    .ifPresent(other -> {
                        log.warn("Username '{}' moved from account {} to {}", username, other.getUserId(), userId);
                        other.setUsername(null);
                        other.setUpdatedAt(now);
                        userAccountRepository.saveAndFlush(other);
                    });
        }
        if (email != null) {
            userAccountRepository.findByEmail(email)
                    .filter(other -> !other.getUserId().equals(userId))
                    .ifPresent(other -> {
                        log.warn("Email of account {} moved to {}", other.getUserId(), userId);
                        other.setEmail(null);
                        other.setUpdatedAt(now);
                        userAccountRepository.saveAndFlush(other);
                    });
        }
    }

    private UserAccount insertPlaceholder(String userId) {
        LocalDateTime now = LocalDateTime.now(clock);
        UserAccount account = new UserAccount();
        account.setUserId(userId);
        account.setRole(AccountRole.ENDUSER);
        account.setCreatedAt(now);
        account.setUpdatedAt(now);
        log.info("Created placeholder account for user {}", userId);
        return userAccountRepository.saveAndFlush(account);
    }

    private TransactionTemplate requiresNew() {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        return template;
    }

    private static void requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
    }

    private static String normalizeEmail(String email) {
        return email == null || email.isBlank() ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    private static String normalizeUsername(String username) {
        return username == null || username.isBlank() ? null : username.trim();
    }
}
