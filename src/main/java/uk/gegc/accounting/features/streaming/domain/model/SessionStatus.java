package uk.gegc.accounting.features.streaming.domain.model;

public enum SessionStatus {
    ACTIVE,
    FINALIZED,
    ABORTED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
