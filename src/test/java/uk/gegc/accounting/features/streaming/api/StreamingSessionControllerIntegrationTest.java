package uk.gegc.accounting.features.streaming.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.ResultActions;
import uk.gegc.accounting.BaseIntegrationTest;
import uk.gegc.accounting.features.credit.application.CreditLedgerService;
import uk.gegc.accounting.features.credit.domain.model.CreditAllocation;
import uk.gegc.accounting.features.credit.infra.repository.CreditAllocationRepository;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static uk.gegc.accounting.testutils.TestTokens.bearer;

@DisplayName("Streaming session endpoints")
class StreamingSessionControllerIntegrationTest extends BaseIntegrationTest {

    private static final String USER = "stream-user-1";
    private static final String BASE = "/api/v1/streaming-sessions";

    @Autowired
    private CreditLedgerService creditLedgerService;

    @Autowired
    private CreditAllocationRepository allocationRepository;

    private String auth;

    @BeforeEach
    void setUp() {
        auth = bearer(USER, "ENDUSER");
    }

    private ResultActions initialize(String sessionId, long estimatedTokens) throws Exception {
        return mockMvc.perform(post(BASE + "/initialize")
                .header("Authorization", auth)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(Map.of("sessionId", sessionId, "modelId", "test-model", "estimatedTokens", estimatedTokens))));
    }

    private ResultActions finalizeSession(String sessionId, long actualTokens) throws Exception {
        return mockMvc.perform(post(BASE + "/finalize")
                .header("Authorization", auth)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(Map.of("sessionId", sessionId, "actualTokens", actualTokens))));
    }

    private ResultActions abort(String sessionId, long tokensGenerated) throws Exception {
        return mockMvc.perform(post(BASE + "/abort")
                .header("Authorization", auth)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(Map.of("sessionId", sessionId, "tokensGenerated", tokensGenerated))));
    }

    private ResultActions balance() throws Exception {
        return mockMvc.perform(get("/api/v1/credits/balance").header("Authorization", auth));
    }

    @Test
    @DisplayName("initialize holds the estimate and finalize refunds the unused part")
    void initializeThenFinalize() throws Exception {
        // Given
        creditLedgerService.allocate(USER, 1000, "system", null, null);

        // When / Then
        initialize("s1", 200_000)
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.allocatedCredits").value(200));
        balance().andExpect(jsonPath("$.totalCredits").value(800));

        finalizeSession("s1", 150_000)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FINALIZED"))
                .andExpect(jsonPath("$.actualCredits").value(150))
                .andExpect(jsonPath("$.chargedCredits").value(150))
                .andExpect(jsonPath("$.refund").value(50))
                .andExpect(jsonPath("$.reconciliationRequired").value(false));
        balance().andExpect(jsonPath("$.totalCredits").value(850));

        mockMvc.perform(get("/api/v1/usage/stats").header("Authorization", auth))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.byService['chat-streaming']").value(150))
                .andExpect(jsonPath("$.recentActivity[0].metadata.refund").value(50));
    }

    @Test
    @DisplayName("abort charges partial usage and refunds the rest")
    void abortRefundsRemainder() throws Exception {
        creditLedgerService.allocate(USER, 1000, "system", null, null);
        initialize("s2", 200_000).andExpect(status().isCreated());

        abort("s2", 50_000)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ABORTED"))
                .andExpect(jsonPath("$.partialCredits").value(50))
                .andExpect(jsonPath("$.refund").value(150));

        balance().andExpect(jsonPath("$.totalCredits").value(950));
        mockMvc.perform(get(BASE + "/active").header("Authorization", auth))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    @DisplayName("initialize beyond the balance returns 402 and creates nothing")
    void insufficientBalance() throws Exception {
        creditLedgerService.allocate(USER, 50, "system", null, null);

        initialize("s3", 200_000)
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.errorCode").value("INSUFFICIENT_CREDITS_FOR_SESSION"))
                .andExpect(jsonPath("$.balance").value(50))
                .andExpect(jsonPath("$.required").value(200));

        Integer sessions = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM streaming_sessions", Integer.class);
        assertThat(sessions).isZero();
        balance().andExpect(jsonPath("$.totalCredits").value(50));
    }

    @Test
    @DisplayName("expired allocations stop counting without being drained")
    void expiredAllocationsDropOut() throws Exception {
        balance().andExpect(status().isOk());
        mockMvc.perform(post("/api/v1/admin/credits/allocate")
                        .header("Authorization", bearer("admin-1", "ADMIN"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("identifier", USER, "credits", 500, "expiryDays", 1))))
                .andExpect(status().isCreated());

        // wind the expiry back past now
        List<CreditAllocation> allocations = allocationRepository.findByUserIdOrderByCreatedAtDesc(USER);
        allocations.forEach(a -> a.setExpiresAt(LocalDateTime.now(ZoneOffset.UTC).minusMinutes(1)));
        allocationRepository.saveAll(allocations);

        balance().andExpect(jsonPath("$.totalCredits").value(0));
        assertThat(allocationRepository.findByUserIdOrderByCreatedAtDesc(USER))
                .singleElement()
                .satisfies(a -> assertThat(a.getRemainingCredits()).isEqualTo(500));
        initialize("s4", 1000).andExpect(status().isPaymentRequired());
    }

    @Test
    @DisplayName("a second settlement is rejected and changes nothing")
    void doubleSettlement() throws Exception {
        creditLedgerService.allocate(USER, 1000, "system", null, null);
        initialize("s5", 200_000).andExpect(status().isCreated());
        finalizeSession("s5", 150_000).andExpect(status().isOk());

        finalizeSession("s5", 150_000)
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("SESSION_ALREADY_SETTLED"));
        abort("s5", 0).andExpect(status().isConflict());

        balance().andExpect(jsonPath("$.totalCredits").value(850));
        Integer usage = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM usage_records", Integer.class);
        assertThat(usage).isEqualTo(1);
    }

    @Test
    @DisplayName("a reused session id is rejected")
    void duplicateSessionId() throws Exception {
        creditLedgerService.allocate(USER, 1000, "system", null, null);
        initialize("s6", 10_000).andExpect(status().isCreated());

        initialize("s6", 10_000)
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("SESSION_ALREADY_EXISTS"));
        balance().andExpect(jsonPath("$.totalCredits").value(990));
    }

    @Test
    @DisplayName("sessions of other users cannot be settled")
    void foreignSession() throws Exception {
        creditLedgerService.allocate(USER, 1000, "system", null, null);
        initialize("s7", 10_000).andExpect(status().isCreated());

        mockMvc.perform(post(BASE + "/finalize")
                        .header("Authorization", bearer("intruder", "ENDUSER"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("sessionId", "s7", "actualTokens", 0))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("SESSION_NOT_FOUND"));
    }

    @Test
    @DisplayName("system-wide session views need SESSIONS_VIEW_ALL")
    void sessionViewsNeedCapabilities() throws Exception {
        creditLedgerService.allocate(USER, 1000, "system", null, null);
        initialize("s8", 10_000).andExpect(status().isCreated());

        mockMvc.perform(get(BASE + "/active-all").header("Authorization", auth))
                .andExpect(status().isForbidden());
        mockMvc.perform(get(BASE + "/active-all").header("Authorization", bearer("admin-1", "ADMIN")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));

        mockMvc.perform(get(BASE + "/recent/" + USER).header("Authorization", auth))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].sessionId").value("s8"));
        mockMvc.perform(get(BASE + "/recent/" + USER).header("Authorization", bearer("other", "ENDUSER")))
                .andExpect(status().isForbidden());
        mockMvc.perform(get(BASE + "/active/" + USER).header("Authorization", bearer("sup-1", "SUPERVISOR")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].allocatedCredits").value(10));
    }

    @Test
    @DisplayName("recent views keep a long-running active session ahead of the settled ones")
    void recentListsKeepStuckSessions() throws Exception {
        creditLedgerService.allocate(USER, 1000, "system", null, null);
        initialize("stuck", 1000).andExpect(status().isCreated());
        jdbcTemplate.update("UPDATE streaming_sessions SET created_at = ? WHERE session_id = ?",
                LocalDateTime.now(ZoneOffset.UTC).minusHours(2), "stuck");
        for (int i = 0; i < 50; i++) {
            initialize("done-" + i, 1000).andExpect(status().isCreated());
            finalizeSession("done-" + i, 1000).andExpect(status().isOk());
        }

        mockMvc.perform(get(BASE + "/recent").param("minutesAgo", "5").header("Authorization", bearer("admin-1", "ADMIN")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(50))
                .andExpect(jsonPath("$[0].sessionId").value("stuck"))
                .andExpect(jsonPath("$[0].status").value("ACTIVE"))
                .andExpect(jsonPath("$[1].status").value("FINALIZED"));

        mockMvc.perform(get(BASE + "/recent/" + USER).header("Authorization", auth))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(20))
                .andExpect(jsonPath("$[0].sessionId").value("stuck"));
    }

    @Test
    @DisplayName("a non-positive recent window is a bad request")
    void invalidRecentWindow() throws Exception {
        mockMvc.perform(get(BASE + "/recent").param("minutesAgo", "0").header("Authorization", bearer("admin-1", "ADMIN")))
                .andExpect(status().isBadRequest());
    }
}
