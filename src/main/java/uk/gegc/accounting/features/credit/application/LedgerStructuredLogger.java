package uk.gegc.accounting.features.credit.application;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Structured logging for ledger and settlement writes.
 * Key fields are placed in the MDC for the duration of a single log call.
 */
public class LedgerStructuredLogger {

    /**
     * Log a ledger write operation with structured fields.
     */
    public static void logLedgerWrite(Logger logger, String level, String message,
            String userId, String operation, long amount, long balanceAfter,
            String refId, Object... additionalArgs) {

        MDC.put("ledger.userId", userId);
        MDC.put("ledger.operation", operation);
        MDC.put("ledger.amount", String.valueOf(amount));
        MDC.put("ledger.balanceAfter", String.valueOf(balanceAfter));
        MDC.put("ledger.refId", refId);

        try {
            log(logger, level, message, additionalArgs);
        } finally {
            clearLedgerMDC();
        }
    }

    /**
     * Log a streaming session settlement.
     */
    public static void logSettlement(Logger logger, String level, String message,
            String userId, String sessionId, String outcome, long allocatedCredits,
            long chargedCredits, long refundedCredits, Object... additionalArgs) {

        MDC.put("ledger.userId", userId);
        MDC.put("ledger.sessionId", sessionId);
        MDC.put("ledger.outcome", outcome);
        MDC.put("ledger.allocated", String.valueOf(allocatedCredits));
        MDC.put("ledger.charged", String.valueOf(chargedCredits));
        MDC.put("ledger.refunded", String.valueOf(refundedCredits));

        try {
            log(logger, level, message, additionalArgs);
        } finally {
            clearLedgerMDC();
        }
    }

    /**
     * Clear ledger-specific MDC context.
     */
    public static void clearLedgerMDC() {
        MDC.remove("ledger.userId");
        MDC.remove("ledger.operation");
        MDC.remove("ledger.amount");
        MDC.remove("ledger.balanceAfter");
        MDC.remove("ledger.refId");
        MDC.remove("ledger.sessionId");
        MDC.remove("ledger.outcome");
        MDC.remove("ledger.allocated");
        MDC.remove("ledger.charged");
        MDC.remove("ledger.refunded");
    }

    private static void log(Logger logger, String level, String message, Object... args) {
        switch (level.toLowerCase()) {
            case "warn" -> logger.warn(message, args);
            case "error" -> logger.error(message, args);
            case "debug" -> logger.debug(message, args);
            default -> logger.info(message, args);
        }
    }
}
