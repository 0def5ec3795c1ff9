package com.ward.core.service.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI document served by springdoc at {@code /v3/api-docs}.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:7070}")
    private int serverPort;

    @Value("${spring.application.name:ward-core-service}")
    private String applicationName;

    @Bean
    public OpenAPI wardCoreServiceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title(applicationName)
                        .description("Groups browser and server spans into page sessions, finds waterfalls, "
                                + "N+1 requests and uncached fetches, and streams the results.")
                        .version("1.0.0"))
                .tags(List.of(
                        new Tag().name("Telemetry Ingestion").description("Span and navigation event intake"),
                        new Tag().name("Page Sessions").description("Built sessions and their issues"),
                        new Tag().name("Resources").description("Failed and slow resources across sessions"),
                        new Tag().name("Session Stream").description("Server-sent session updates")))
                .servers(List.of(new Server()
                        .url("http://localhost:" + serverPort)
                        .description("Local dev server")));
    }
}
