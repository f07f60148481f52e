package uk.gegc.accounting.features.account.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.accounting.features.account.api.dto.CreateUserAccountRequest;
import uk.gegc.accounting.features.account.api.dto.UserAccountDto;
import uk.gegc.accounting.features.account.application.IdentityMirrorService;
import uk.gegc.accounting.features.account.domain.model.Capability;
import uk.gegc.accounting.shared.security.annotation.RequireCapability;

@RestController
@RequestMapping("/api/v1/admin/users")
@RequiredArgsConstructor
@Tag(name = "Admin Users", description = "Provision mirror accounts")
@SecurityRequirement(name = "Bearer Authentication")
public class UserAccountAdminController {

    private final IdentityMirrorService identityMirrorService;

    @PostMapping
    @Operation(summary = "Create an account", description = "Provisions a user before their first login. Requires ACCOUNTS_MANAGE.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Account created",
                    content = @Content(schema = @Schema(implementation = UserAccountDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "403", description = "Missing ACCOUNTS_MANAGE"),
            @ApiResponse(responseCode = "409", description = "User id, username or email already taken")
    })
    @RequireCapability(Capability.ACCOUNTS_MANAGE)
    public ResponseEntity<UserAccountDto> createAccount(@Valid @RequestBody CreateUserAccountRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(identityMirrorService.createAccount(request));
    }
}
