package uk.gegc.accounting.features.streaming.application;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Streaming session configuration.
 */
@Configuration
@ConfigurationProperties(prefix = "accounting.streaming")
@Validated
@Data
public class StreamingProperties {

    /**
     * Multiplier applied to the estimated cost when sizing the hold (>= 1.0).
     */
    @DecimalMin("1.0")
    private double safetyFactor = 1.2d;

    /**
     * Usage service recorded for finalized sessions.
     */
    @NotBlank
    private String finalizeService = "chat-streaming";

    /**
     * Usage service recorded for aborted sessions.
     */
    @NotBlank
    private String abortService = "chat-streaming-aborted";

    @Positive
    private int recentWindowMinutes = 5;

    @Positive
    private int recentLimit = 50;

    @Positive
    private int userRecentLimit = 20;

    @Valid
    private Sweeper sweeper = new Sweeper();

    @Data
    public static class Sweeper {
        /**
         * Abort sessions left ACTIVE for longer than {@link #staleAfterMinutes}.
         */
        private boolean enabled = false;

        @Positive
        private long staleAfterMinutes = 60;

        @Positive
        private long intervalMs = 60_000L;
    }
}
