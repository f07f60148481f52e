package uk.gegc.accounting.shared.config;

import io.swagger.v3.oas.annotations.enums.SecuritySchemeType;
import io.swagger.v3.oas.annotations.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups, one per feature.
 */
@Configuration
@SecurityScheme(
        name = "Bearer Authentication",
        type = SecuritySchemeType.HTTP,
        bearerFormat = "JWT",
        scheme = "bearer"
)
public class OpenApiGroupConfig {

    @Bean
    public GroupedOpenApi creditsGroup() {
        return GroupedOpenApi.builder()
                .group("credits")
                .displayName("Credits")
                .pathsToMatch("/api/v1/credits/**")
                .build();
    }

    @Bean
    public GroupedOpenApi streamingGroup() {
        return GroupedOpenApi.builder()
                .group("streaming-sessions")
                .displayName("Streaming Sessions")
                .pathsToMatch("/api/v1/streaming-sessions/**")
                .build();
    }

    @Bean
    public GroupedOpenApi usageGroup() {
        return GroupedOpenApi.builder()
                .group("usage")
                .displayName("Usage & Statistics")
                .pathsToMatch("/api/v1/usage/**")
                .build();
    }

    @Bean
    public GroupedOpenApi adminGroup() {
        return GroupedOpenApi.builder()
                .group("admin")
                .displayName("Administration")
                .pathsToMatch("/api/v1/admin/**")
                .build();
    }
}
