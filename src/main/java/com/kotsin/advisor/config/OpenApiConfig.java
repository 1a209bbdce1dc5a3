package com.kotsin.advisor.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the Signal Advisor
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Kotsin Signal Advisor API")
                        .description("Synthesizes advisory trading signals with entry, stop-loss and a three-level take-profit ladder, " +
                                "then tracks each signal until it completes, stops out or expires.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Kotsin Development Team")
                                .email("dev@kotsin.com")
                                .url("https://kotsin.com"))
                        .license(new License()
                                .name("Private License")
                                .url("https://kotsin.com/license")))
                .servers(List.of(
                        new Server()
                                .url("/")
                                .description("Relative base URL (adapts to active environment)")));
    }
}
