package uk.gegc.accounting.features.credit.application;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Ledger configuration.
 */
@Configuration
@ConfigurationProperties(prefix = "accounting.credits")
@Validated
@Data
public class CreditProperties {

    /**
     * Expiry applied when an allocation is created without an explicit number of days.
     */
    @Positive
    private int defaultExpiryDays = 30;

    /**
     * {@code allocatedBy} recorded on allocations that hold refunded credits.
     */
    @NotBlank
    private String refundAllocator = "system-refund";
}
