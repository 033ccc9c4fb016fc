package uk.gegc.studyscheduler.shared.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation metadata, the bearer scheme referenced by {@code @SecurityRequirement(name = "bearerAuth")},
 * and the documentation group for the scheduling endpoints.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI studySchedulerOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Study Scheduler API")
                        .description("Spaced-repetition review queue, submissions and schedule previews")
                        .version("v1"))
                .components(new Components()
                        .addSecuritySchemes("bearerAuth", new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")));
    }

    @Bean
    public GroupedOpenApi schedulingGroup() {
        return GroupedOpenApi.builder()
                .group("scheduling")
                .displayName("Spaced Repetition Scheduling")
                .pathsToMatch("/api/v1/scheduling/**")
                .build();
    }
}
