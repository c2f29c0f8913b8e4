package com.tutorhub.backend.global.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;

import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "TutorHub API",
                version = "v1",
                description = "Users, tutor profiles and tutor matching requests.\n\n"
                        + "The acting user is identified by the `X-Actor-Id` header."),
        servers = @Server(url = "http://localhost:8080", description = "Local Development"))
public class OpenApiConfig {
}
