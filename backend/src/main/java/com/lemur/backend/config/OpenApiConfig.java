package com.lemur.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI lemurOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Lemur Agent API")
                        .description("Iterative document editing sessions driven by a completion backend, "
                                + "with live edits and observations over WebSocket")
                        .version("1.0.0")
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server().url("http://localhost:8000").description("Development Server")));
    }
}
