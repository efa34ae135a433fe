package com.casebattle.ledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class LedgerConfig {

    /**
     * Wall clock for transaction and recomputation timestamps (system zone, like the exported sheets).
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
