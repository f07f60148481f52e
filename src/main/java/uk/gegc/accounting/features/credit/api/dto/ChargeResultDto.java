package uk.gegc.accounting.features.credit.api.dto;

import java.util.UUID;

public record ChargeResultDto(
        UUID usageRecordId,
        long creditsCharged,
        long remainingBalance
) {}
