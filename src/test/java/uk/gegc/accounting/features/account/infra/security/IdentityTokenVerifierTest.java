package uk.gegc.accounting.features.account.infra.security;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.accounting.features.account.domain.model.AccountRole;
import uk.gegc.accounting.testutils.TestTokens;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IdentityTokenVerifier")
class IdentityTokenVerifierTest {

    private static final String OTHER_SECRET = "b3RoZXItc2VjcmV0LXRoYXQtaXMtbG9uZy1lbm91Z2gtZm9yLWhtYWMtc2hhMjU2LWtleXM=";

    private IdentityTokenVerifier verifier;

    @BeforeEach
    void setUp() {
        IdentityTokenProperties properties = new IdentityTokenProperties();
        properties.setJwtSecret(TestTokens.SECRET);
        verifier = new IdentityTokenVerifier(properties);
        verifier.init();
    }

    @Test
    @DisplayName("valid access token yields the identity tuple")
    void validToken() {
        String token = TestTokens.accessToken("u1", "alice", "alice@example.com", "SUPERVISOR");

        Optional<VerifiedIdentity> identity = verifier.verify(token);

        assertThat(identity).contains(new VerifiedIdentity("u1", "alice", "alice@example.com", AccountRole.SUPERVISOR));
    }

    @Test
    @DisplayName("role claim is matched case-insensitively")
    void lowercaseRole() {
        assertThat(verifier.verify(TestTokens.accessToken("u1", "admin")))
                .map(VerifiedIdentity::role)
                .contains(AccountRole.ADMIN);
    }

    @Test
    @DisplayName("unknown role is rejected")
    void unknownRole() {
        assertThat(verifier.verify(TestTokens.accessToken("u1", "superuser"))).isEmpty();
    }

    @Test
    @DisplayName("refresh tokens are rejected")
    void refreshToken() {
        String token = TestTokens.sign(TestTokens.SECRET, "u1", "u1", "u1@example.com", "ENDUSER",
                "refresh", Duration.ofMinutes(5));

        assertThat(verifier.verify(token)).isEmpty();
    }

    @Test
    @DisplayName("token signed with another secret is rejected")
    void wrongSecret() {
        String token = TestTokens.sign(OTHER_SECRET, "u1", "u1", "u1@example.com", "ENDUSER",
                "access", Duration.ofMinutes(5));

        assertThat(verifier.verify(token)).isEmpty();
    }

    @Test
    @DisplayName("expired token is rejected")
    void expiredToken() {
        String token = TestTokens.sign(TestTokens.SECRET, "u1", "u1", "u1@example.com", "ENDUSER",
                "access", Duration.ofMinutes(-1));

        assertThat(verifier.verify(token)).isEmpty();
    }

    @Test
    @DisplayName("garbage is rejected")
    void garbage() {
        assertThat(verifier.verify("not-a-jwt")).isEmpty();
        assertThat(verifier.verify("")).isEmpty();
    }
}
