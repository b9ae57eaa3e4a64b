package com.bookstore.rental.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // Due dates, overdue days and late fees are all computed against this clock.
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
