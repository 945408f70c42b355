package com.mailroom.health;

import java.time.Instant;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import com.mailroom.config.MailroomProperties;

import reactor.core.publisher.Mono;

@RestController
public class HealthController {

    private final MailroomProperties properties;

    public HealthController(MailroomProperties properties) {
        this.properties = properties;
    }

    @GetMapping("/")
    public Mono<HealthResponse> health() {
        return Mono.fromSupplier(() ->
                new HealthResponse(properties.serviceName(), "healthy", Instant.now()));
    }
}
