package io.recoverly.ledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core beans of the ledger service.
 *
 * The clock is read only at the boundary (event listener, scheduler);
 * engine calculations take an explicit as-of date.
 */
@Configuration
public class LedgerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
