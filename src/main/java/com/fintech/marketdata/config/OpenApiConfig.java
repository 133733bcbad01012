package com.fintech.marketdata.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for API documentation.
 *
 * Access the interactive API documentation at:
 * - Swagger UI: http://localhost:8080/swagger-ui/index.html
 * - OpenAPI JSON: http://localhost:8080/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI marketDataIngestionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Market Data Ingestion Service API")
                        .description("""
                                Historical OHLCV ingestion and query service.

                                **Features:**
                                - Resumable bulk downloads (1m, 5m, 15m, 30m, 60m, 1D)
                                - Operator endpoints: start, resume, repair, stop, status with ETA
                                - Month-partitioned storage with de-duplicating merges
                                - Series validation (nulls, duplicates, OHLC consistency)

                                **Tech Stack:**
                                - Spring Boot 3.2
                                - resilience4j rate limiter and circuit breaker
                                - Chronicle Map task registry backend
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8080")
                                .description("Local Development Server")
                ));
    }
}
