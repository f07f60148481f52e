package uk.gegc.accounting.features.account.infra.security;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for verifying access tokens issued by the external authentication service.
 */
@Configuration
@ConfigurationProperties(prefix = "accounting.identity")
@Validated
@Data
public class IdentityTokenProperties {

    /**
     * Base64-encoded HMAC secret shared with the authentication service.
     */
    @NotBlank
    private String jwtSecret;

    /**
     * Value the {@code type} claim must carry; refresh tokens are rejected.
     */
    @NotBlank
    private String acceptedTokenType = "access";
}
