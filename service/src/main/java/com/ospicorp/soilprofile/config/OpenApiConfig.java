package com.ospicorp.soilprofile.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  /** Only enforced when {@code security.auth.enabled=true}. */
  static final String BEARER_SCHEME = "bearer-jwt";

  @Bean
  OpenAPI apiInfo() {
    return new OpenAPI()
        .info(new Info()
            .title("Soil Profile API")
            .version("v1")
            .description("Validated soil and environmental profiles aggregated from weather, "
                + "reanalysis and soil-grid sources")
            .contact(new Contact().name("Soil Data Platform Team").email("api-support@example.com"))
            .license(new License().name("MIT")))
        .servers(List.of(new Server().url("/")))
        .components(new Components().addSecuritySchemes(BEARER_SCHEME, new SecurityScheme()
            .type(SecurityScheme.Type.HTTP)
            .scheme("bearer")
            .bearerFormat("JWT")))
        .externalDocs(new ExternalDocumentation()
            .description("Data quality levels and source notes")
            .url("https://docs.soil-profile-api.dev"));
  }
}
