package uk.gegc.accounting.features.admin.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.accounting.features.account.domain.model.Capability;
import uk.gegc.accounting.features.admin.api.dto.AdminAdjustCreditsRequest;
import uk.gegc.accounting.features.admin.api.dto.AdminAllocateCreditsRequest;
import uk.gegc.accounting.features.admin.api.dto.AdminRemoveCreditsRequest;
import uk.gegc.accounting.features.admin.api.dto.AdminSetCreditsRequest;
import uk.gegc.accounting.features.admin.application.CreditAdministrationService;
import uk.gegc.accounting.features.credit.api.dto.BalanceChangeDto;
import uk.gegc.accounting.features.credit.api.dto.BalanceDto;
import uk.gegc.accounting.features.credit.api.dto.CreditAllocationDto;
import uk.gegc.accounting.shared.security.AuthenticatedCaller;
import uk.gegc.accounting.shared.security.annotation.RequireCapability;

@RestController
@RequestMapping("/api/v1/admin/credits")
@RequiredArgsConstructor
@Tag(name = "Admin Credits", description = "Manage any user's credits")
@SecurityRequirement(name = "Bearer Authentication")
public class CreditAdminController {

    private final CreditAdministrationService administrationService;

    @PostMapping("/allocate")
    @Operation(summary = "Allocate credits", description = "Creates a new allocation for the target. Requires CREDITS_MANAGE.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Credits allocated",
                    content = @Content(schema = @Schema(implementation = CreditAllocationDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid amount"),
            @ApiResponse(responseCode = "403", description = "Missing CREDITS_MANAGE",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Target user not found")
    })
    @RequireCapability(Capability.CREDITS_MANAGE)
    public ResponseEntity<CreditAllocationDto> allocate(
            @AuthenticationPrincipal AuthenticatedCaller caller,
            @Valid @RequestBody AdminAllocateCreditsRequest request) {
        CreditAllocationDto allocation = administrationService.allocate(
                caller, request.identifier(), request.credits(), request.expiryDays(), request.notes());
        return ResponseEntity.status(HttpStatus.CREATED).body(allocation);
    }

    @PostMapping("/set")
    @Operation(summary = "Set the balance to an exact amount",
            description = "Zeroes every active allocation and grants the new amount. Requires CREDITS_MANAGE.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Balance set"),
            @ApiResponse(responseCode = "403", description = "Missing CREDITS_MANAGE"),
            @ApiResponse(responseCode = "404", description = "Target user not found")
    })
    @RequireCapability(Capability.CREDITS_MANAGE)
    public ResponseEntity<BalanceChangeDto> setCredits(
            @AuthenticationPrincipal AuthenticatedCaller caller,
            @Valid @RequestBody AdminSetCreditsRequest request) {
        return ResponseEntity.ok(administrationService.setAbsolute(
                caller, request.identifier(), request.credits(), request.expiryDays(), request.notes()));
    }

    @PutMapping("/adjust")
    @Operation(summary = "Adjust the balance by a signed delta", description = "Requires CREDITS_MANAGE.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Balance adjusted"),
            @ApiResponse(responseCode = "400", description = "Zero delta"),
            @ApiResponse(responseCode = "402", description = "Negative delta exceeds the balance"),
            @ApiResponse(responseCode = "403", description = "Missing CREDITS_MANAGE"),
            @ApiResponse(responseCode = "404", description = "Target user not found")
    })
    @RequireCapability(Capability.CREDITS_MANAGE)
    public ResponseEntity<BalanceChangeDto> adjustCredits(
            @AuthenticationPrincipal AuthenticatedCaller caller,
            @Valid @RequestBody AdminAdjustCreditsRequest request) {
        return ResponseEntity.ok(administrationService.adjust(
                caller, request.identifier(), request.delta(), request.expiryDays(), request.notes()));
    }

    @PostMapping("/remove")
    @Operation(summary = "Remove credits", description = "Requires CREDITS_MANAGE.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Credits removed"),
            @ApiResponse(responseCode = "402", description = "Balance lower than the amount"),
            @ApiResponse(responseCode = "403", description = "Missing CREDITS_MANAGE"),
            @ApiResponse(responseCode = "404", description = "Target user not found")
    })
    @RequireCapability(Capability.CREDITS_MANAGE)
    public ResponseEntity<BalanceChangeDto> removeCredits(
            @AuthenticationPrincipal AuthenticatedCaller caller,
            @Valid @RequestBody AdminRemoveCreditsRequest request) {
        return ResponseEntity.ok(administrationService.remove(caller, request.identifier(), request.credits()));
    }

    @GetMapping("/balance/{identifier}")
    @Operation(summary = "Get any user's balance", description = "Requires CREDITS_VIEW_ANY.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Balance returned",
                    content = @Content(schema = @Schema(implementation = BalanceDto.class))),
            @ApiResponse(responseCode = "403", description = "Missing CREDITS_VIEW_ANY"),
            @ApiResponse(responseCode = "404", description = "Target user not found")
    })
    @RequireCapability(Capability.CREDITS_VIEW_ANY)
    public ResponseEntity<BalanceDto> getBalance(
            @AuthenticationPrincipal AuthenticatedCaller caller,
            @Parameter(description = "User id, username or email") @PathVariable String identifier) {
        return ResponseEntity.ok(administrationService.getBalance(caller, identifier));
    }
}
