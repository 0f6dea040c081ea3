package com.ammann.trustlens.health;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

/**
 * Liveness health check that reports the TrustLens API process as alive.
 *
 * <p>Carries the configured service name so that probes hitting several deployments can tell
 * them apart.
 */
@Liveness
public class LivenessCheck implements HealthCheck
{
    static final String HEALTH_CHECK_NAME = "alive";

    @ConfigProperty(name = "trustlens.service-name", defaultValue = "trustlens-api")
    String serviceName;

    @Override
    public HealthCheckResponse call()
    {
        return HealthCheckResponse.named(HEALTH_CHECK_NAME)
                .withData("service", serviceName != null ? serviceName : "unknown")
                .up()
                .build();
    }

}
