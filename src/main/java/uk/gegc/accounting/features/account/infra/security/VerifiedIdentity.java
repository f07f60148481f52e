package uk.gegc.accounting.features.account.infra.security;

import uk.gegc.accounting.features.account.domain.model.AccountRole;

public record VerifiedIdentity(
        String userId,
        String username,
        String email,
        AccountRole role
) {}
