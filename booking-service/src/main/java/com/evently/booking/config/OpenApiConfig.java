package com.evently.booking.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.HeaderParameter;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    static final String CLIENT_ID_PARAMETER = "clientId";

    @Value("${server.port:8082}")
    private String serverPort;

    @Bean
    public OpenAPI bookingServiceOpenAPI() {
        Info info = new Info()
                .title("Evently Booking Service API")
                .version("1.0.0")
                .description("Show discovery and seat reservation. Seats are locked per show and held " +
                            "until confirmed, cancelled or reclaimed by the expiry sweep. Show and booking " +
                            "routes pass through a demand-based waiting room; deferred calls receive 429 " +
                            "with Retry-After and a queue token.")
                .contact(new Contact().name("Evently Platform Team").email("platform@evently.dev"));

        // Admission and rate limiting key on this header, falling back to the remote address
        HeaderParameter clientId = new HeaderParameter();
        clientId.name("X-Client-Id")
                .description("Stable client identity used by the waiting room and rate limiter")
                .required(false)
                .schema(new StringSchema());

        return new OpenAPI()
                .info(info)
                .components(new Components().addParameters(CLIENT_ID_PARAMETER, clientId))
                .servers(List.of(new Server()
                        .url("http://localhost:" + serverPort)
                        .description("Local")));
    }
}
