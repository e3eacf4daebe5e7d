package com.al.ccda2omop.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for auto-generated API documentation.
 * Access Swagger UI at: /swagger-ui.html
 * Access OpenAPI JSON at: /v3/api-docs
 */
@Configuration
public class OpenApiConfig {

        @Value("${spring.application.name:ccda2omop}")
        private String applicationName;

        @Bean
        public OpenAPI customOpenAPI() {
                return new OpenAPI()
                                .info(new Info()
                                                .title(applicationName + " API")
                                                .version("1.0.0")
                                                .description("""
                                                                Rule-driven conversion of C-CDA clinical documents into OMOP CDM 5.3 rows.

                                                                ## Features
                                                                - **YAML Mapping Rules**: section entries mapped to OMOP tables by declarative rules
                                                                - **Concept Mapping**: source codes resolved to standard concepts through the OMOP vocabulary
                                                                - **Domain Routing**: entries routed to the table matching their concept domain
                                                                - **Conversion Report**: coverage, field population and mapping quality metrics
                                                                """)
                                                .contact(new Contact()
                                                                .name("CCDA2OMOP Team")
                                                                .email("support@example.com"))
                                                .license(new License()
                                                                .name("Proprietary License")
                                                                .url("https://example.com/licensing")))
                                .servers(List.of(
                                                new Server()
                                                                .url("http://localhost:8080")
                                                                .description("Local Development")))
                                .tags(List.of(
                                                new Tag().name("Conversion")
                                                                .description("C-CDA to OMOP conversion endpoints"),
                                                new Tag().name("Rules")
                                                                .description("Loaded mapping rules")));
        }
}
