/* (C)2026 */
package com.ammann.trustlens.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Clock;

/**
 * CDI producer for the wall clock used by freshness metrics and the read API.
 *
 * <p>All time-dependent services receive the clock through injection so that tests can
 * substitute a fixed clock and get deterministic results.
 */
@ApplicationScoped
public class ClockProducer {

    /**
     * Produces the UTC system clock.
     *
     * @return clock shared by all services
     */
    @Produces
    @Singleton
    public Clock systemClock() {
        return Clock.systemUTC();
    }
}
