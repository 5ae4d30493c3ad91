package com.interactiveemotes.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Clock used to timestamp emotes for combo timeouts. Tests swap in a fixed or manual clock. */
@Configuration
public class ClockConfig {

    @Bean
    public Clock engineClock() {
        return Clock.systemUTC();
    }
}
