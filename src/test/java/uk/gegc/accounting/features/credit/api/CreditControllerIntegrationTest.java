package uk.gegc.accounting.features.credit.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import uk.gegc.accounting.BaseIntegrationTest;
import uk.gegc.accounting.features.credit.application.CreditLedgerService;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static uk.gegc.accounting.testutils.TestTokens.bearer;

@DisplayName("Credit endpoints")
class CreditControllerIntegrationTest extends BaseIntegrationTest {

    private static final String USER = "user-credits-1";

    @Autowired
    private CreditLedgerService creditLedgerService;

    @Test
    @DisplayName("requests without a token are rejected with 401")
    void unauthenticated() throws Exception {
        mockMvc.perform(get("/api/v1/credits/balance"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("requests with an invalid token are rejected with 401")
    void invalidToken() throws Exception {
        mockMvc.perform(get("/api/v1/credits/balance").header("Authorization", "Bearer not-a-token"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("first authenticated request creates the mirror account with an empty balance")
    void firstContact() throws Exception {
        mockMvc.perform(get("/api/v1/credits/balance").header("Authorization", bearer(USER, "enduser")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value(USER))
                .andExpect(jsonPath("$.totalCredits").value(0))
                .andExpect(jsonPath("$.activeAllocations").isEmpty());

        Integer accounts = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM users WHERE user_id = ?", Integer.class, USER);
        assertThat(accounts).isEqualTo(1);
    }

    @Test
    @DisplayName("balance sums unexpired allocations, soonest expiry first")
    void balance() throws Exception {
        creditLedgerService.allocate(USER, 300, "system", 0, null);
        creditLedgerService.allocate(USER, 200, "system", 10, null);

        mockMvc.perform(get("/api/v1/credits/balance").header("Authorization", bearer(USER, "ENDUSER")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCredits").value(500))
                .andExpect(jsonPath("$.activeAllocations.length()").value(2))
                .andExpect(jsonPath("$.activeAllocations[0].remainingCredits").value(200))
                .andExpect(jsonPath("$.activeAllocations[1].expiresAt").doesNotExist());
    }

    @Test
    @DisplayName("check reports affordability against the current balance")
    void check() throws Exception {
        creditLedgerService.allocate(USER, 100, "system", null, null);

        mockMvc.perform(post("/api/v1/credits/check")
                        .header("Authorization", bearer(USER, "ENDUSER"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("requiredCredits", 150))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sufficient").value(false))
                .andExpect(jsonPath("$.currentBalance").value(100))
                .andExpect(jsonPath("$.requiredCredits").value(150));
    }

    @Test
    @DisplayName("calculate prices tokens with the model table")
    void calculate() throws Exception {
        mockMvc.perform(post("/api/v1/credits/calculate")
                        .header("Authorization", bearer(USER, "ENDUSER"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("modelId", "test-model", "tokens", 1500))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.credits").value(2))
                .andExpect(jsonPath("$.tokenKind").value("BOTH"));
    }

    @Test
    @DisplayName("deduct charges the balance and records usage")
    void deduct() throws Exception {
        creditLedgerService.allocate(USER, 100, "system", null, null);

        mockMvc.perform(post("/api/v1/credits/deduct")
                        .header("Authorization", bearer(USER, "ENDUSER"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("credits", 25, "service", "chat", "operation", "test-model",
                                "metadata", Map.of("requestId", "r-1")))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.creditsCharged").value(25))
                .andExpect(jsonPath("$.remainingBalance").value(75))
                .andExpect(jsonPath("$.usageRecordId").isNotEmpty());

        Integer usage = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM usage_records WHERE user_id = ? AND credits = 25", Integer.class, USER);
        assertThat(usage).isEqualTo(1);
    }

    @Test
    @DisplayName("deduct beyond the balance returns 402 and changes nothing")
    void deductInsufficient() throws Exception {
        creditLedgerService.allocate(USER, 10, "system", null, null);

        mockMvc.perform(post("/api/v1/credits/deduct")
                        .header("Authorization", bearer(USER, "ENDUSER"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("credits", 25, "service", "chat", "operation", "test-model"))))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.errorCode").value("INSUFFICIENT_CREDITS"))
                .andExpect(jsonPath("$.balance").value(10))
                .andExpect(jsonPath("$.required").value(25))
                .andExpect(jsonPath("$.shortfall").value(15));

        assertThat(creditLedgerService.currentBalance(USER)).isEqualTo(10);
        Integer usage = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM usage_records", Integer.class);
        assertThat(usage).isZero();
    }

    @Test
    @DisplayName("non-positive deduct is a validation error")
    void deductValidation() throws Exception {
        mockMvc.perform(post("/api/v1/credits/deduct")
                        .header("Authorization", bearer(USER, "ENDUSER"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("credits", 0, "service", "chat", "operation", "test-model"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"));
    }

    @Test
    @DisplayName("listing another user's allocations needs CREDITS_VIEW_ANY")
    void allocationsNeedCapability() throws Exception {
        creditLedgerService.allocate("someone-else", 50, "system", null, null);

        mockMvc.perform(get("/api/v1/credits/allocations/someone-else").header("Authorization", bearer(USER, "ENDUSER")))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/api/v1/credits/allocations/someone-else").header("Authorization", bearer("sup-1", "SUPERVISOR")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].totalCredits").value(50));
    }
}
