package uk.gegc.accounting.features.credit.application.impl;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.accounting.features.credit.api.dto.ChargeResultDto;
import uk.gegc.accounting.features.credit.application.CreditChargeService;
import uk.gegc.accounting.features.credit.application.CreditLedgerService;
import uk.gegc.accounting.features.credit.domain.exception.InsufficientCreditsException;
import uk.gegc.accounting.features.usage.api.dto.UsageRecordDto;
import uk.gegc.accounting.features.usage.application.UsageRecorderService;
import uk.gegc.accounting.shared.exception.InvalidAmountException;

import java.util.Map;

@Service
@RequiredArgsConstructor
public class CreditChargeServiceImpl implements CreditChargeService {

    private static final Logger log = LoggerFactory.getLogger(CreditChargeServiceImpl.class);

    private final CreditLedgerService creditLedgerService;
    private final UsageRecorderService usageRecorderService;

    @Override
    @Transactional
    public ChargeResultDto charge(String userId, long credits, String service, String operation, Map<String, Object> metadata) {
        if (credits <= 0) {
            throw new InvalidAmountException("Credits to charge must be greater than zero");
        }
        if (service == null || service.isBlank() || operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("service and operation must not be blank");
        }

        if (!creditLedgerService.deduct(userId, credits)) {
            long balance = creditLedgerService.currentBalance(userId);
            log.info("Charge of {} credits for {}/{} refused for user {} (balance {})",
                    credits, service, operation, userId, balance);
            throw new InsufficientCreditsException(balance, credits);
        }

        UsageRecordDto usage = usageRecorderService.record(userId, service, operation, credits, metadata);
        long remaining = creditLedgerService.currentBalance(userId);
        return new ChargeResultDto(usage.id(), credits, remaining);
    }
}
