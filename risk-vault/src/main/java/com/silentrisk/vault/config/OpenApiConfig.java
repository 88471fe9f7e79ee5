package com.silentrisk.vault.config;

import io.swagger.v3.oas.models.*;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI riskVaultOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Risk Vault API")
                        .version("1.0.0")
                        .description("API for submitting private risk attestations, minting risk passports and answering threshold queries."));
    }

    @Bean
    public GroupedOpenApi vaultGroup() {
        return GroupedOpenApi.builder()
                .group("vault")
                .pathsToMatch("/api/vault/**")
                .build();
    }

    @Bean
    public GroupedOpenApi passportGroup() {
        return GroupedOpenApi.builder()
                .group("passport")
                .pathsToMatch("/api/passport/**")
                .build();
    }

    @Bean
    public GroupedOpenApi adminGroup() {
        return GroupedOpenApi.builder()
                .group("admin")
                .pathsToMatch("/api/admin/**", "/api/events/**")
                .build();
    }

}
