package uk.gegc.accounting.features.credit.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.accounting.features.account.domain.model.Capability;
import uk.gegc.accounting.features.credit.api.dto.BalanceDto;
import uk.gegc.accounting.features.credit.api.dto.CalculateCreditsRequest;
import uk.gegc.accounting.features.credit.api.dto.CalculateCreditsResponse;
import uk.gegc.accounting.features.credit.api.dto.ChargeResultDto;
import uk.gegc.accounting.features.credit.api.dto.CreditAllocationDto;
import uk.gegc.accounting.features.credit.api.dto.CreditCheckRequest;
import uk.gegc.accounting.features.credit.api.dto.CreditCheckResponse;
import uk.gegc.accounting.features.credit.api.dto.DeductCreditsRequest;
import uk.gegc.accounting.features.credit.application.CreditChargeService;
import uk.gegc.accounting.features.credit.application.CreditLedgerService;
import uk.gegc.accounting.features.pricing.application.PricingFunction;
import uk.gegc.accounting.features.pricing.domain.model.TokenKind;
import uk.gegc.accounting.shared.security.AuthenticatedCaller;
import uk.gegc.accounting.shared.security.annotation.RequireCapability;

import java.util.List;

@RestController
@RequestMapping("/api/v1/credits")
@RequiredArgsConstructor
@Tag(name = "Credits", description = "Balance queries and synchronous charges for the authenticated user")
@SecurityRequirement(name = "Bearer Authentication")
public class CreditController {

    private final CreditLedgerService creditLedgerService;
    private final CreditChargeService creditChargeService;
    private final PricingFunction pricingFunction;

    @Operation(summary = "Get current balance", description = "Sum of remaining credits over unexpired allocations, with the allocations that make it up")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Balance returned",
                    content = @Content(schema = @Schema(implementation = BalanceDto.class))),
            @ApiResponse(responseCode = "401", description = "Unauthorized")
    })
    @GetMapping("/balance")
    public ResponseEntity<BalanceDto> getBalance(@AuthenticationPrincipal AuthenticatedCaller caller) {
        return ResponseEntity.ok(creditLedgerService.getBalance(caller.userId()));
    }

    @Operation(summary = "Check whether the caller can afford an operation")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Check performed"),
            @ApiResponse(responseCode = "400", description = "Invalid amount"),
            @ApiResponse(responseCode = "401", description = "Unauthorized")
    })
    @PostMapping("/check")
    public ResponseEntity<CreditCheckResponse> checkCredits(
            @AuthenticationPrincipal AuthenticatedCaller caller,
            @Valid @RequestBody CreditCheckRequest request) {
        long required = request.requiredCredits();
        boolean sufficient = creditLedgerService.hasSufficientCredits(caller.userId(), required);
        long balance = creditLedgerService.currentBalance(caller.userId());
        return ResponseEntity.ok(new CreditCheckResponse(sufficient, balance, required));
    }

    @Operation(summary = "Calculate the credit cost of a token count", description = "Uses the configured model rate table")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Cost calculated"),
            @ApiResponse(responseCode = "400", description = "Invalid input"),
            @ApiResponse(responseCode = "401", description = "Unauthorized")
    })
    @PostMapping("/calculate")
    public ResponseEntity<CalculateCreditsResponse> calculateCredits(@Valid @RequestBody CalculateCreditsRequest request) {
        TokenKind kind = request.tokenKind() != null ? request.tokenKind() : TokenKind.BOTH;
        long credits = pricingFunction.creditsFor(request.modelId(), request.tokens(), kind);
        return ResponseEntity.ok(new CalculateCreditsResponse(request.modelId(), request.tokens(), kind, credits));
    }

    @Operation(summary = "Charge the caller for a synchronous operation",
            description = "Deducts credits and records usage atomically; nothing is charged when the balance is insufficient")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Credits charged"),
            @ApiResponse(responseCode = "400", description = "Invalid amount"),
            @ApiResponse(responseCode = "401", description = "Unauthorized"),
            @ApiResponse(responseCode = "402", description = "Insufficient credits"),
            @ApiResponse(responseCode = "409", description = "Concurrent modification, safe to retry")
    })
    @PostMapping("/deduct")
    public ResponseEntity<ChargeResultDto> deductCredits(
            @AuthenticationPrincipal AuthenticatedCaller caller,
            @Valid @RequestBody DeductCreditsRequest request) {
        ChargeResultDto result = creditChargeService.charge(
                caller.userId(), request.credits(), request.service(), request.operation(), request.metadata());
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "List every allocation of a user", description = "Includes drained and expired allocations. Requires CREDITS_VIEW_ANY.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Allocations returned",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = CreditAllocationDto.class)))),
            @ApiResponse(responseCode = "401", description = "Unauthorized"),
            @ApiResponse(responseCode = "403", description = "Missing capability")
    })
    @GetMapping("/allocations/{userId}")
    @RequireCapability(Capability.CREDITS_VIEW_ANY)
    public ResponseEntity<List<CreditAllocationDto>> listAllocations(
            @Parameter(description = "Target user id") @PathVariable String userId) {
        return ResponseEntity.ok(creditLedgerService.listAllocations(userId));
    }
}
