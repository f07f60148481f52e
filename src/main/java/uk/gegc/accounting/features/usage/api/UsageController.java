package uk.gegc.accounting.features.usage.api;

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
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.accounting.features.account.domain.model.Capability;
import uk.gegc.accounting.features.usage.api.dto.RecordUsageRequest;
import uk.gegc.accounting.features.usage.api.dto.SystemUsageStatsDto;
import uk.gegc.accounting.features.usage.api.dto.UsageRecordDto;
import uk.gegc.accounting.features.usage.api.dto.UserUsageStatsDto;
import uk.gegc.accounting.features.usage.application.UsageRecorderService;
import uk.gegc.accounting.shared.security.AuthenticatedCaller;
import uk.gegc.accounting.shared.security.annotation.RequireCapability;

import java.time.LocalDateTime;

@RestController
@RequestMapping("/api/v1/usage")
@RequiredArgsConstructor
@Tag(name = "Usage", description = "Usage log and aggregate statistics")
@SecurityRequirement(name = "Bearer Authentication")
public class UsageController {

    private final UsageRecorderService usageRecorderService;

    @Operation(summary = "Record usage for the caller", description = "Appends to the usage log without touching the balance")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Usage recorded",
                    content = @Content(schema = @Schema(implementation = UsageRecordDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "401", description = "Unauthorized")
    })
    @PostMapping("/record")
    public ResponseEntity<UsageRecordDto> recordUsage(
            @AuthenticationPrincipal AuthenticatedCaller caller,
            @Valid @RequestBody RecordUsageRequest request) {
        UsageRecordDto record = usageRecorderService.record(
                caller.userId(), request.service(), request.operation(), request.credits(), request.metadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(record);
    }

    @Operation(summary = "Usage statistics for the caller")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Statistics returned"),
            @ApiResponse(responseCode = "400", description = "Invalid range"),
            @ApiResponse(responseCode = "401", description = "Unauthorized")
    })
    @GetMapping("/stats")
    public ResponseEntity<UserUsageStatsDto> getMyStats(
            @AuthenticationPrincipal AuthenticatedCaller caller,
            @Parameter(description = "Inclusive start, ISO date-time")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @Parameter(description = "Inclusive end, ISO date-time")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {
        return ResponseEntity.ok(usageRecorderService.getUserStats(caller.userId(), from, to));
    }

    @Operation(summary = "Usage statistics for any user", description = "Requires USAGE_VIEW_ANY")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Statistics returned"),
            @ApiResponse(responseCode = "403", description = "Missing capability")
    })
    @GetMapping("/stats/{userId}")
    @RequireCapability(Capability.USAGE_VIEW_ANY)
    public ResponseEntity<UserUsageStatsDto> getUserStats(
            @Parameter(description = "Target user id") @PathVariable String userId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {
        return ResponseEntity.ok(usageRecorderService.getUserStats(userId, from, to));
    }

    @Operation(summary = "System-wide usage statistics", description = "Requires USAGE_VIEW_SYSTEM")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Statistics returned"),
            @ApiResponse(responseCode = "403", description = "Missing capability")
    })
    @GetMapping("/system-stats")
    @RequireCapability(Capability.USAGE_VIEW_SYSTEM)
    public ResponseEntity<SystemUsageStatsDto> getSystemStats(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {
        return ResponseEntity.ok(usageRecorderService.getSystemStats(from, to));
    }
}
