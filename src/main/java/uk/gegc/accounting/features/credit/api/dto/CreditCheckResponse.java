package uk.gegc.accounting.features.credit.api.dto;

public record CreditCheckResponse(
        boolean sufficient,
        long currentBalance,
        long requiredCredits
) {}
