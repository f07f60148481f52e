package uk.gegc.accounting.features.credit.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "BalanceChangeDto", description = "Balance before and after an administrative change")
public record BalanceChangeDto(
        String userId,
        long previousBalance,
        long newBalance
) {}
