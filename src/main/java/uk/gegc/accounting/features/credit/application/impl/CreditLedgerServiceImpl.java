package uk.gegc.accounting.features.credit.application.impl;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;
import uk.gegc.accounting.features.account.application.IdentityMirrorService;
import uk.gegc.accounting.features.credit.api.dto.BalanceChangeDto;
import uk.gegc.accounting.features.credit.api.dto.BalanceDto;
import uk.gegc.accounting.features.credit.api.dto.CreditAllocationDto;
import uk.gegc.accounting.features.credit.application.CreditLedgerService;
import uk.gegc.accounting.features.credit.application.CreditMetricsService;
import uk.gegc.accounting.features.credit.application.CreditProperties;
import uk.gegc.accounting.features.credit.application.LedgerStructuredLogger;
import uk.gegc.accounting.features.credit.application.UserLedgerLock;
import uk.gegc.accounting.features.credit.domain.exception.InsufficientCreditsException;
import uk.gegc.accounting.features.credit.domain.model.AllocationDraw;
import uk.gegc.accounting.features.credit.domain.model.CreditAllocation;
import uk.gegc.accounting.features.credit.infra.mapping.CreditAllocationMapper;
import uk.gegc.accounting.features.credit.infra.repository.CreditAllocationRepository;
import uk.gegc.accounting.shared.exception.InvalidAmountException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Validated
@RequiredArgsConstructor
public class CreditLedgerServiceImpl implements CreditLedgerService {

    private static final Logger log = LoggerFactory.getLogger(CreditLedgerServiceImpl.class);

    /**
     * Soonest expiry first, never-expiring last, then oldest grant.
     */
    static final Comparator<CreditAllocation> DRAW_ORDER = Comparator
            .comparing(CreditAllocation::getExpiresAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(CreditAllocation::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(CreditAllocation::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final CreditAllocationRepository allocationRepository;
    private final CreditAllocationMapper allocationMapper;
    private final IdentityMirrorService identityMirrorService;
    private final UserLedgerLock ledgerLock;
    private final CreditProperties creditProperties;
    private final CreditMetricsService metricsService;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public BalanceDto getBalance(String userId) {
        List<CreditAllocation> active = activeAllocations(userId, now());
        long total = sum(active);
        return new BalanceDto(userId, total, active.stream().map(allocationMapper::toSummary).toList());
    }

    @Override
    @Transactional(readOnly = true)
    public long currentBalance(String userId) {
        return allocationRepository.sumActiveRemainingCredits(userId, now());
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasSufficientCredits(String userId, long required) {
        if (required < 0) {
            throw new InvalidAmountException("Required credits must be non-negative");
        }
        if (required == 0) {
            return true;
        }
        return currentBalance(userId) >= required;
    }

    @Override
    @Transactional
    public CreditAllocationDto allocate(String userId, long credits, String allocatedBy, Integer expiryDays, String notes) {
        requirePositive(credits, "Credits to allocate");
        LocalDateTime now = now();
        LocalDateTime expiresAt = resolveExpiry(expiryDays, now);

        identityMirrorService.ensureAccountExists(userId);
        ledgerLock.lockExisting(userId);

        CreditAllocation saved = createAllocation(userId, credits, allocatedBy, expiresAt, notes, now);
        long balanceAfter = allocationRepository.sumActiveRemainingCredits(userId, now);

        metricsService.incrementCreditsAllocated(saved.getAllocatedBy(), credits);
        LedgerStructuredLogger.logLedgerWrite(log, "info",
                "Allocated {} credits to user {} (expires {})",
                userId, "ALLOCATE", credits, balanceAfter, saved.getId().toString(),
                credits, userId, expiresAt != null ? expiresAt : "never");
        return allocationMapper.toDto(saved);
    }

    @Override
    @Transactional
    public boolean deduct(String userId, long credits) {
        requirePositive(credits, "Credits to deduct");
        boolean deducted = lockAndDraw(userId, credits).isPresent();
        if (!deducted) {
            log.info("Deduction of {} credits refused for user {}: insufficient balance", credits, userId);
        }
        return deducted;
    }

    @Override
    @Transactional
    public Optional<List<AllocationDraw>> reserve(String userId, long credits) {
        requirePositive(credits, "Credits to reserve");
        return lockAndDraw(userId, credits);
    }

    @Override
    @Transactional
    public BalanceChangeDto setAbsolute(String userId, long credits, String setBy, Integer expiryDays, String notes) {
        if (credits < 0) {
            throw new InvalidAmountException("Credits must be non-negative");
        }
        LocalDateTime now = now();
        LocalDateTime expiresAt = resolveExpiry(expiryDays, now);

        ledgerLock.lockExisting(userId);
        List<CreditAllocation> active = activeAllocations(userId, now);
        long previous = sum(active);

        active.forEach(allocation -> allocation.setRemainingCredits(0L));
        allocationRepository.saveAll(active);

        String refId = null;
        if (credits > 0) {
            CreditAllocation replacement = createAllocation(userId, credits, setBy, expiresAt, notes, now);
            refId = replacement.getId().toString();
            metricsService.incrementCreditsAllocated(replacement.getAllocatedBy(), credits);
        }

        LedgerStructuredLogger.logLedgerWrite(log, "info",
                "Balance of user {} set from {} to {} by {}",
                userId, "SET", credits - previous, credits, refId,
                userId, previous, credits, setBy);
        return new BalanceChangeDto(userId, previous, credits);
    }

    @Override
    @Transactional
    public BalanceChangeDto adjust(String userId, long delta, String adjustedBy, Integer expiryDays, String notes) {
        if (delta == 0) {
            throw new InvalidAmountException("Adjustment must be non-zero");
        }
        LocalDateTime now = now();

        if (delta > 0) {
            LocalDateTime expiresAt = resolveExpiry(expiryDays, now);
            identityMirrorService.ensureAccountExists(userId);
            ledgerLock.lockExisting(userId);
            long previous = allocationRepository.sumActiveRemainingCredits(userId, now);
            CreditAllocation saved = createAllocation(userId, delta, adjustedBy, expiresAt, notes, now);
            metricsService.incrementCreditsAllocated(saved.getAllocatedBy(), delta);
            LedgerStructuredLogger.logLedgerWrite(log, "info",
                    "Adjusted balance of user {} by +{}",
                    userId, "ADJUST", delta, previous + delta, saved.getId().toString(),
                    userId, delta);
            return new BalanceChangeDto(userId, previous, previous + delta);
        }

        long amount = Math.negateExact(delta);
        ledgerLock.lockExisting(userId);
        List<CreditAllocation> active = activeAllocations(userId, now);
        long previous = sum(active);
        if (previous < amount) {
            throw new InsufficientCreditsException(previous, amount);
        }
        drawFrom(active, amount);
        metricsService.incrementCreditsDeducted(amount);
        LedgerStructuredLogger.logLedgerWrite(log, "info",
                "Adjusted balance of user {} by -{}",
                userId, "ADJUST", -amount, previous - amount, null,
                userId, amount);
        return new BalanceChangeDto(userId, previous, previous - amount);
    }

    @Override
    @Transactional
    public long refund(String userId, List<AllocationDraw> draws, long credits, String notes) {
        if (credits < 0) {
            throw new InvalidAmountException("Refund must be non-negative");
        }
        if (credits == 0) {
            return 0L;
        }
        LocalDateTime now = now();
        ledgerLock.lockExisting(userId);

        long remaining = credits;
        List<AllocationDraw> ordered = draws != null ? new ArrayList<>(draws) : new ArrayList<>();
        Collections.reverse(ordered);

        Map<UUID, CreditAllocation> sources = allocationRepository
                .findAllById(ordered.stream().map(AllocationDraw::allocationId).toList())
                .stream()
                .collect(Collectors.toMap(CreditAllocation::getId, Function.identity()));

        List<CreditAllocation> restored = new ArrayList<>();
        for (AllocationDraw draw : ordered) {
            if (remaining == 0) {
                break;
            }
            CreditAllocation source = sources.get(draw.allocationId());
            if (source == null || !source.getUserId().equals(userId)) {
                continue;
            }
            if (source.isExpiredAt(now)) {
                continue;
            }
            long headroom = source.getTotalCredits() - source.getRemainingCredits();
            long restore = Math.min(Math.min(draw.credits(), headroom), remaining);
            if (restore > 0) {
                source.setRemainingCredits(source.getRemainingCredits() + restore);
                restored.add(source);
                remaining -= restore;
            }
        }
        allocationRepository.saveAll(restored);

        String refId = null;
        if (remaining > 0) {
            LocalDateTime expiresAt = now.plusDays(creditProperties.getDefaultExpiryDays());
            CreditAllocation overflow = createAllocation(
                    userId, remaining, creditProperties.getRefundAllocator(), expiresAt, notes, now);
            refId = overflow.getId().toString();
        }

        metricsService.incrementCreditsRefunded(credits);
        LedgerStructuredLogger.logLedgerWrite(log, "info",
                "Refunded {} credits to user {} ({} restored in place)",
                userId, "REFUND", credits, allocationRepository.sumActiveRemainingCredits(userId, now), refId,
                credits, userId, credits - remaining);
        return credits;
    }

    @Override
    @Transactional(readOnly = true)
    public List<CreditAllocationDto> listAllocations(String userId) {
        return allocationMapper.toDtos(allocationRepository.findByUserIdOrderByCreatedAtDesc(userId));
    }

    private Optional<List<AllocationDraw>> lockAndDraw(String userId, long credits) {
        if (ledgerLock.lock(userId).isEmpty()) {
            return Optional.empty();
        }
        LocalDateTime now = now();
        List<CreditAllocation> active = activeAllocations(userId, now);
        long balance = sum(active);
        if (balance < credits) {
            return Optional.empty();
        }

        List<AllocationDraw> draws = drawFrom(active, credits);
        metricsService.incrementCreditsDeducted(credits);
        LedgerStructuredLogger.logLedgerWrite(log, "info",
                "Deducted {} credits from user {} across {} allocation(s)",
                userId, "DEDUCT", credits, balance - credits, null,
                credits, userId, draws.size());
        return Optional.of(draws);
    }

    /**
     * Takes {@code credits} from allocations already sorted in draw order. The caller has checked
     * that they cover the amount.
     */
    private List<AllocationDraw> drawFrom(List<CreditAllocation> active, long credits) {
        long remaining = credits;
        List<AllocationDraw> draws = new ArrayList<>();
        List<CreditAllocation> touched = new ArrayList<>();
        for (CreditAllocation allocation : active) {
            if (remaining == 0) {
                break;
            }
            long take = Math.min(allocation.getRemainingCredits(), remaining);
            allocation.setRemainingCredits(allocation.getRemainingCredits() - take);
            draws.add(new AllocationDraw(allocation.getId(), take));
            touched.add(allocation);
            remaining -= take;
        }
        allocationRepository.saveAll(touched);
        return draws;
    }

    private CreditAllocation createAllocation(String userId, long credits, String allocatedBy,
                                              LocalDateTime expiresAt, String notes, LocalDateTime now) {
        CreditAllocation allocation = new CreditAllocation();
        allocation.setUserId(userId);
        allocation.setTotalCredits(credits);
        allocation.setRemainingCredits(credits);
        allocation.setAllocatedBy(allocatedBy != null && !allocatedBy.isBlank() ? allocatedBy : "system");
        allocation.setCreatedAt(now);
        allocation.setExpiresAt(expiresAt);
        allocation.setNotes(notes);
        return allocationRepository.save(allocation);
    }

    private List<CreditAllocation> activeAllocations(String userId, LocalDateTime now) {
        List<CreditAllocation> active = new ArrayList<>(allocationRepository.findActiveByUserId(userId, now));
        active.sort(DRAW_ORDER);
        return active;
    }

    private LocalDateTime resolveExpiry(Integer expiryDays, LocalDateTime now) {
        if (expiryDays == null) {
            return now.plusDays(creditProperties.getDefaultExpiryDays());
        }
        if (expiryDays < 0) {
            throw new InvalidAmountException("Expiry days must be non-negative");
        }
        return expiryDays == 0 ? null : now.plusDays(expiryDays);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static long sum(List<CreditAllocation> allocations) {
        return allocations.stream().mapToLong(CreditAllocation::getRemainingCredits).sum();
    }

    private static void requirePositive(long value, String label) {
        if (value <= 0) {
            throw new InvalidAmountException(label + " must be greater than zero");
        }
    }
}
