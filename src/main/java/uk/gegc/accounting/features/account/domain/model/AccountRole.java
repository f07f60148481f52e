package uk.gegc.accounting.features.account.domain.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Closed set of roles carried in identity claims.
 * Each role lists its capabilities explicitly; a role never inherits from another.
 */
public enum AccountRole {

    ENDUSER(EnumSet.noneOf(Capability.class)),

    SUPERVISOR(EnumSet.of(
            Capability.CREDITS_MANAGE,
            Capability.CREDITS_VIEW_ANY,
            Capability.USAGE_VIEW_ANY,
            Capability.SESSIONS_VIEW_ANY
    )),

    ADMIN(EnumSet.of(
            Capability.CREDITS_MANAGE,
            Capability.CREDITS_VIEW_ANY,
            Capability.USAGE_VIEW_ANY,
            Capability.SESSIONS_VIEW_ANY,
            Capability.USAGE_VIEW_SYSTEM,
            Capability.SESSIONS_VIEW_ALL,
            Capability.ACCOUNTS_MANAGE
    ));

    private final Set<Capability> capabilities;

    AccountRole(Set<Capability> capabilities) {
        this.capabilities = Collections.unmodifiableSet(capabilities);
    }

    public Set<Capability> capabilities() {
        return capabilities;
    }

    public boolean grants(Capability capability) {
        return capabilities.contains(capability);
    }

    /**
     * Parses a role claim case-insensitively ("admin", "ADMIN", "Admin").
     */
    public static Optional<AccountRole> fromClaim(String claim) {
        if (claim == null || claim.isBlank()) {
            return Optional.empty();
        }
        String normalized = claim.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(role -> role.name().equals(normalized))
                .findFirst();
    }
}
