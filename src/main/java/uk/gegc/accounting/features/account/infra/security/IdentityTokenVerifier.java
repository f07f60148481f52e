package uk.gegc.accounting.features.account.infra.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.accounting.features.account.domain.model.AccountRole;

import javax.crypto.SecretKey;
import java.util.Optional;

/**
 * Verifies access tokens signed by the authentication service and extracts the identity tuple.
 * Claims: {@code sub}, {@code username}, {@code email}, {@code role}, {@code type}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IdentityTokenVerifier {

    private final IdentityTokenProperties properties;

    private SecretKey key;

    @PostConstruct
    public void init() {
        byte[] keyBytes = Decoders.BASE64.decode(properties.getJwtSecret());
        this.key = Keys.hmacShaKeyFor(keyBytes);
    }

    public Optional<VerifiedIdentity> verify(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String userId = claims.getSubject();
            if (userId == null || userId.isBlank()) {
                log.warn("Identity token missing subject");
                return Optional.empty();
            }

            String type = claims.get("type", String.class);
            if (!properties.getAcceptedTokenType().equals(type)) {
                log.warn("Rejecting token of type '{}' for subject {}", type, userId);
                return Optional.empty();
            }

            String roleClaim = claims.get("role", String.class);
            Optional<AccountRole> role = AccountRole.fromClaim(roleClaim);
            if (role.isEmpty()) {
                log.warn("Rejecting token with unknown role '{}' for subject {}", roleClaim, userId);
                return Optional.empty();
            }

            return Optional.of(new VerifiedIdentity(
                    userId,
                    claims.get("username", String.class),
                    claims.get("email", String.class),
                    role.get()
            ));
        } catch (ExpiredJwtException ex) {
            log.debug("Identity token is expired: {}", ex.getMessage());
            return Optional.empty();
        } catch (MalformedJwtException ex) {
            log.warn("Malformed identity token received: {}", ex.getMessage());
            return Optional.empty();
        } catch (SignatureException ex) {
            log.warn("Invalid identity token signature: {}", ex.getMessage());
            return Optional.empty();
        } catch (IllegalArgumentException ex) {
            log.warn("Illegal argument passed to JWT parser: {}", ex.getMessage());
            return Optional.empty();
        } catch (JwtException ex) {
            log.error("Unexpected JWT exception: {}", ex.getMessage());
            return Optional.empty();
        }
    }
}
