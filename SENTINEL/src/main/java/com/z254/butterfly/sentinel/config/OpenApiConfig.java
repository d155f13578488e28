package com.z254.butterfly.sentinel.config;

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
 * OpenAPI documentation configuration for SENTINEL service.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8087}")
    private int serverPort;

    @Bean
    public OpenAPI sentinelOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("SENTINEL Autonomic Operations API")
                        .description("""
                                SENTINEL is the autonomic operations engine for the BUTTERFLY ecosystem.

                                ## Features

                                - **Anomaly Detection**: Isolation-forest ensemble with statistical fallback
                                - **Forecasting**: Trend and seasonal projection, capacity exhaustion estimates
                                - **Alerting**: Deduplicated, correlated alerts with root-cause hints
                                - **Self-Healing**: Incident classification, remediation with rollback and escalation
                                - **Predictive Scaling**: Cooldown-guarded scale decisions

                                ## Integration

                                SENTINEL integrates with:
                                - Remediation connector: executes healing actions
                                - Kafka: notification fan-out
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("BUTTERFLY Team")
                                .email("butterfly@254studioz.com")
                                .url("https://254carbon.com"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server"),
                        new Server()
                                .url("http://sentinel-service:8087")
                                .description("Kubernetes service")
                ))
                .tags(List.of(
                        new Tag()
                                .name("Telemetry")
                                .description("Telemetry and deployment intake"),
                        new Tag()
                                .name("Services")
                                .description("Service health, forecasts and scaling"),
                        new Tag()
                                .name("Alerts")
                                .description("Active alerts and correlations"),
                        new Tag()
                                .name("Incidents")
                                .description("Incident querying")
                ));
    }
}
