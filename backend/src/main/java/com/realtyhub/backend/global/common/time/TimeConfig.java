package com.realtyhub.backend.global.common.time;

import java.time.Clock;
import java.time.ZoneOffset;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Single UTC clock shared by every workflow so review, assignment and contact timestamps are comparable.
 * Business-day boundaries ("today" statistics) are derived separately from {@code realtyhub.time-zone}.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }
}
