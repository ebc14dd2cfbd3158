package com.biblioteca.backend.health;

import java.time.Clock;
import java.time.Instant;

import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse("UP", Instant.now(clock).toString());
    }

    @GetMapping("/readyz")
    public HealthResponse readyz() {
        HealthComponent healthComponent = healthEndpoint.health();
        String status = healthComponent.getStatus().getCode();

        if (healthComponent instanceof CompositeHealth composite) {
            HealthComponent dbDetail = composite.getComponents().get("db");
            if (dbDetail instanceof Health dbHealth) {
                status = dbHealth.getStatus().getCode();
            }
        }

        return new HealthResponse(status, Instant.now(clock).toString());
    }

    public record HealthResponse(
        String status,   // "UP" | "DOWN"
        String timestamp // ISO-8601 timestamp
    ) {}
}
