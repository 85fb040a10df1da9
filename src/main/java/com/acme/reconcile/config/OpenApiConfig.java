package com.acme.reconcile.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI metadata for the reconciliation API.
 */
@Configuration
public class OpenApiConfig {

    @Value("${spring.application.name}")
    private String applicationName;

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI reconcileServiceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Invoice Reconciliation API")
                        .description("Reconciles invoices against purchase orders and goods receipts, " +
                                    "explains each verdict and drafts dispute emails for human approval. " +
                                    "Served by " + applicationName + ".")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Accounts Payable Platform")
                                .email("ap-platform@example.com"))
                        .license(new License()
                                .name("Proprietary")
                                .url("https://example.com/license")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Development server")
                ));
    }
}
