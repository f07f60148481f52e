package uk.gegc.accounting.features.credit.domain.model;

import java.util.UUID;

/**
 * Credits taken from a single allocation by one reservation.
 */
public record AllocationDraw(UUID allocationId, long credits) {
}
