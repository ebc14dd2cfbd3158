package com.biblioteca.backend.global.config;

import org.springframework.boot.actuate.web.exchanges.HttpExchangeRepository;
import org.springframework.boot.actuate.web.exchanges.InMemoryHttpExchangeRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Actuator settings.
 */
@Configuration
public class ActuatorConfig {

    /**
     * Backs the admin-only {@code /actuator/httpexchanges} endpoint.
     * The in-memory repository keeps the last 100 exchanges only.
     */
    @Bean
    public HttpExchangeRepository httpExchangeRepository() {
        return new InMemoryHttpExchangeRepository();
    }
}
