package com.bookati.reservation.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Lock purge and outbox relay run on the scheduler. Switched off in tests that drive them by hand.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "reservation.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
