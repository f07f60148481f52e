package uk.gegc.accounting.features.pricing.application;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Model rate table: credits charged per 1000 input and output tokens.
 */
@Configuration
@ConfigurationProperties(prefix = "accounting.pricing")
@Validated
@Data
public class PricingProperties {

    @Valid
    private List<ModelRate> models = new ArrayList<>();

    /**
     * Rate applied to models missing from {@link #models}.
     */
    @Valid
    @NotNull
    private Rate defaultRate = new Rate(new BigDecimal("0.200"), new BigDecimal("0.500"));

    @Data
    public static class Rate {
        @NotNull
        @DecimalMin("0.0")
        private BigDecimal inputPer1k;

        @NotNull
        @DecimalMin("0.0")
        private BigDecimal outputPer1k;

        public Rate() {
        }

        public Rate(BigDecimal inputPer1k, BigDecimal outputPer1k) {
            this.inputPer1k = inputPer1k;
            this.outputPer1k = outputPer1k;
        }
    }

    @Data
    public static class ModelRate {
        @NotBlank
        private String modelId;

        @NotNull
        @DecimalMin("0.0")
        private BigDecimal inputPer1k;

        @NotNull
        @DecimalMin("0.0")
        private BigDecimal outputPer1k;
    }
}
