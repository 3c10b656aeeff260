package com.carelink.backend.global.common.time;

import java.time.Clock;
import java.time.ZoneOffset;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Lockout windows, token expiries, audit timestamps and the nightly document expiry all read this clock.
 * A test context may register its own fixed {@link Clock} to replace it.
 */
@Configuration
public class ClockConfig {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock systemUtcClock() {
        return Clock.system(ZoneOffset.UTC);
    }
}
