package uk.gegc.comicmaker.shared.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiGroupConfig {

    @Bean
    public OpenAPI comicMakerOpenApi() {
        return new OpenAPI()
                .info(new Info().title("ComicMaker API").version("v1"))
                .components(new Components().addSecuritySchemes("bearerAuth",
                        new SecurityScheme().type(SecurityScheme.Type.HTTP).scheme("bearer").bearerFormat("JWT")))
                .addSecurityItem(new SecurityRequirement().addList("bearerAuth"));
    }

    @Bean
    public GroupedOpenApi authGroup() {
        return GroupedOpenApi.builder()
                .group("auth")
                .displayName("Authentication & Users")
                .pathsToMatch("/api/v1/auth/**")
                .build();
    }

    @Bean
    public GroupedOpenApi projectsGroup() {
        return GroupedOpenApi.builder()
                .group("projects")
                .displayName("Projects, Scenes & Generation")
                .pathsToMatch("/api/v1/projects/**")
                .build();
    }

    @Bean
    public GroupedOpenApi paymentsGroup() {
        return GroupedOpenApi.builder()
                .group("payments")
                .displayName("Payments")
                .pathsToMatch("/api/v1/payments/**")
                .build();
    }
}
