package uk.gegc.accounting.features.streaming.api;

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
import uk.gegc.accounting.features.streaming.api.dto.AbortResultDto;
import uk.gegc.accounting.features.streaming.api.dto.AbortSessionRequest;
import uk.gegc.accounting.features.streaming.api.dto.FinalizeResultDto;
import uk.gegc.accounting.features.streaming.api.dto.FinalizeSessionRequest;
import uk.gegc.accounting.features.streaming.api.dto.InitializeSessionRequest;
import uk.gegc.accounting.features.streaming.api.dto.StreamingSessionDto;
import uk.gegc.accounting.features.streaming.application.StreamingSessionService;
import uk.gegc.accounting.shared.security.AuthenticatedCaller;
import uk.gegc.accounting.shared.security.CallerContext;
import uk.gegc.accounting.shared.security.annotation.RequireCapability;

import java.util.List;

@RestController
@RequestMapping("/api/v1/streaming-sessions")
@RequiredArgsConstructor
@Tag(name = "Streaming Sessions", description = "Hold credits for a streaming call, then settle it against actual usage")
@SecurityRequirement(name = "Bearer Authentication")
public class StreamingSessionController {

    private final StreamingSessionService sessionService;
    private final CallerContext callerContext;

    @Operation(summary = "Open a streaming session", description = "Prices the estimate, applies the safety factor and holds the result")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Session opened",
                    content = @Content(schema = @Schema(implementation = StreamingSessionDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "401", description = "Unauthorized"),
            @ApiResponse(responseCode = "402", description = "Balance does not cover the hold"),
            @ApiResponse(responseCode = "409", description = "Session id already used")
    })
    @PostMapping("/initialize")
    public ResponseEntity<StreamingSessionDto> initialize(
            @AuthenticationPrincipal AuthenticatedCaller caller,
            @Valid @RequestBody InitializeSessionRequest request) {
        StreamingSessionDto session = sessionService.initialize(
                request.sessionId(), caller.userId(), request.modelId(), request.estimatedTokens());
        return ResponseEntity.status(HttpStatus.CREATED).body(session);
    }

    @Operation(summary = "Finalize a streaming session", description = "Charges the actual tokens and refunds the rest of the hold")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session settled"),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "401", description = "Unauthorized"),
            @ApiResponse(responseCode = "404", description = "Session not found"),
            @ApiResponse(responseCode = "409", description = "Session already settled")
    })
    @PostMapping("/finalize")
    public ResponseEntity<FinalizeResultDto> finalizeSession(
            @AuthenticationPrincipal AuthenticatedCaller caller,
            @Valid @RequestBody FinalizeSessionRequest request) {
        boolean success = request.success() == null || request.success();
        return ResponseEntity.ok(sessionService.finalizeSession(
                request.sessionId(), caller.userId(), request.actualTokens(), success));
    }

    @Operation(summary = "Abort a streaming session", description = "Charges the tokens generated so far and refunds the rest of the hold")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session settled"),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "401", description = "Unauthorized"),
            @ApiResponse(responseCode = "404", description = "Session not found"),
            @ApiResponse(responseCode = "409", description = "Session already settled")
    })
    @PostMapping("/abort")
    public ResponseEntity<AbortResultDto> abortSession(
            @AuthenticationPrincipal AuthenticatedCaller caller,
            @Valid @RequestBody AbortSessionRequest request) {
        long tokens = request.tokensGenerated() != null ? request.tokensGenerated() : 0L;
        return ResponseEntity.ok(sessionService.abortSession(request.sessionId(), caller.userId(), tokens));
    }

    @Operation(summary = "List the caller's active sessions")
    @ApiResponse(responseCode = "200", description = "Sessions returned",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = StreamingSessionDto.class))))
    @GetMapping("/active")
    public ResponseEntity<List<StreamingSessionDto>> getActiveSessions(@AuthenticationPrincipal AuthenticatedCaller caller) {
        return ResponseEntity.ok(sessionService.getActiveSessions(caller.userId()));
    }

    @Operation(summary = "List a user's active sessions", description = "Requires SESSIONS_VIEW_ANY")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Sessions returned"),
            @ApiResponse(responseCode = "403", description = "Missing capability")
    })
    @GetMapping("/active/{userId}")
    @RequireCapability(Capability.SESSIONS_VIEW_ANY)
    public ResponseEntity<List<StreamingSessionDto>> getActiveSessionsForUser(
            @Parameter(description = "Target user id") @PathVariable String userId) {
        return ResponseEntity.ok(sessionService.getActiveSessions(userId));
    }

    @Operation(summary = "List every active session", description = "Requires SESSIONS_VIEW_ALL")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Sessions returned"),
            @ApiResponse(responseCode = "403", description = "Missing capability")
    })
    @GetMapping("/active-all")
    @RequireCapability(Capability.SESSIONS_VIEW_ALL)
    public ResponseEntity<List<StreamingSessionDto>> getAllActiveSessions() {
        return ResponseEntity.ok(sessionService.getAllActiveSessions());
    }

    @Operation(summary = "List recent sessions system-wide",
            description = "Active sessions plus those settled in the window, newest first. Requires SESSIONS_VIEW_ALL")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Sessions returned"),
            @ApiResponse(responseCode = "400", description = "Invalid window"),
            @ApiResponse(responseCode = "403", description = "Missing capability")
    })
    @GetMapping("/recent")
    @RequireCapability(Capability.SESSIONS_VIEW_ALL)
    public ResponseEntity<List<StreamingSessionDto>> getRecentSessions(
            @Parameter(description = "Window in minutes, default 5") @RequestParam(required = false) Integer minutesAgo) {
        return ResponseEntity.ok(sessionService.getRecentSessions(minutesAgo));
    }

    @Operation(summary = "List a user's recent sessions", description = "Own sessions, or any user's with SESSIONS_VIEW_ANY")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Sessions returned"),
            @ApiResponse(responseCode = "400", description = "Invalid window"),
            @ApiResponse(responseCode = "403", description = "Not the caller's sessions")
    })
    @GetMapping("/recent/{userId}")
    public ResponseEntity<List<StreamingSessionDto>> getRecentSessionsForUser(
            @Parameter(description = "Target user id") @PathVariable String userId,
            @Parameter(description = "Window in minutes, default 5") @RequestParam(required = false) Integer minutesAgo) {
        callerContext.requireSelfOr(userId, Capability.SESSIONS_VIEW_ANY);
        return ResponseEntity.ok(sessionService.getRecentSessions(userId, minutesAgo));
    }
}
