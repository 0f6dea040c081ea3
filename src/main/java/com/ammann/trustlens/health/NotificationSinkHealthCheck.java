/* (C)2026 */
package com.ammann.trustlens.health;

import com.ammann.trustlens.notification.NotificationSink;
import com.ammann.trustlens.store.TabularStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness check reporting the alerting setup.
 *
 * <p>The notification webhook is optional, so the check is always UP; the data section
 * tells operators whether alerts will actually be delivered and which sources are loaded.
 */
@Readiness
@ApplicationScoped
public class NotificationSinkHealthCheck implements HealthCheck {

    static final String HEALTH_CHECK_NAME = "alerting";

    @Inject NotificationSink notificationSink;

    @Inject TabularStore store;

    @Override
    public HealthCheckResponse call() {
        boolean configured = notificationSink != null && notificationSink.isConfigured();

        HealthCheckResponseBuilder builder =
                HealthCheckResponse.named(HEALTH_CHECK_NAME)
                        .withData("webhook-configured", configured)
                        .withData("loaded-sources", store != null ? store.sourceKeys().size() : 0L);

        if (!configured) {
            builder.withData("message", "No webhook configured - alerts are evaluated but not delivered");
        }
        return builder.up().build();
    }
}
