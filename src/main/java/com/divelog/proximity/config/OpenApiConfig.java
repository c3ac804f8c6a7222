package com.divelog.proximity.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation for the proximity API.
 *
 * - Swagger UI: http://localhost:8080/swagger-ui.html
 * - OpenAPI JSON: http://localhost:8080/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI diveProximityOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Dive Proximity Engine API")
                        .description("Decides which dive sites are watched as geofences around the device, " +
                                "how aggressively the device samples its position, and when the scheduler " +
                                "itself is unhealthy.\n\n" +
                                "## WebSocket Endpoints\n\n" +
                                "Connect to: `ws://localhost:8080/ws/device`\n\n" +
                                "- `/app/position` - Send position readings\n" +
                                "- `/app/position/failure` - Report failed fixes\n" +
                                "- `/topic/device/sampling` - Receive sampling directives\n" +
                                "- `/topic/device/consent` - Receive consent prompt requests\n" +
                                "- `/topic/reminders` - Receive dive log reminders\n" +
                                "- `/topic/safe-mode` - Receive safe mode requests\n\n" +
                                "## Getting Started\n\n" +
                                "1. Start PostgreSQL with PostGIS extension\n" +
                                "2. Start Redis server\n" +
                                "3. Run: `mvn spring-boot:run`\n" +
                                "4. Access Swagger UI: http://localhost:8080/swagger-ui.html")
                        .version("1.0.0")
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")
                ));
    }
}
