package uk.gegc.accounting.features.account.domain.model;

/**
 * Operations beyond acting on one's own ledger. Granted per role in {@link AccountRole}.
 */
public enum Capability {
    CREDITS_MANAGE,
    CREDITS_VIEW_ANY,
    USAGE_VIEW_ANY,
    USAGE_VIEW_SYSTEM,
    SESSIONS_VIEW_ANY,
    SESSIONS_VIEW_ALL,
    ACCOUNTS_MANAGE
}
