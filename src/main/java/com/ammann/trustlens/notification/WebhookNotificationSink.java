/* (C)2026 */
package com.ammann.trustlens.notification;

import com.ammann.trustlens.model.DeliveryOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.Response;
import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.rest.client.RestClientBuilder;
import org.jboss.logging.Logger;

/**
 * Notification sink that posts {@code {"text": message}} to an incoming webhook (Slack or
 * a compatible endpoint).
 *
 * <p>The destination is optional. Without a valid {@code trustlens.notification.webhook-url}
 * every call returns {@link DeliveryOutcome#notConfigured()}. With a destination, each call
 * makes exactly one POST with bounded connect and read timeouts; there is no retry and no
 * queuing. Non-2xx responses and transport errors are reported as failed outcomes.
 *
 * <p>Configuration:
 * <ul>
 *   <li>{@code trustlens.notification.webhook-url} - webhook URL, usually taken from
 *       {@code SLACK_WEBHOOK_URL} (optional)</li>
 *   <li>{@code trustlens.notification.timeout} - connect and read timeout (default: 5s)</li>
 * </ul>
 */
@ApplicationScoped
public class WebhookNotificationSink implements NotificationSink {

    private static final Logger LOG = Logger.getLogger(WebhookNotificationSink.class);
    private static final String DISABLE_DEFAULT_MAPPER =
            "microprofile.rest.client.disable.default.mapper";

    private final WebhookClient client;
    private final MeterRegistry meterRegistry;

    @Inject
    public WebhookNotificationSink(
            @ConfigProperty(name = "trustlens.notification.webhook-url") Optional<String> webhookUrl,
            @ConfigProperty(name = "trustlens.notification.timeout", defaultValue = "5s") Duration timeout,
            MeterRegistry meterRegistry) {
        this(resolve(webhookUrl).map(uri -> buildClient(uri, timeout)).orElse(null), meterRegistry);
    }

    WebhookNotificationSink(WebhookClient client, MeterRegistry meterRegistry) {
        this.client = client;
        this.meterRegistry = meterRegistry;

        if (client == null) {
            LOG.warn("No notification webhook configured - alerts will not be delivered");
        }
    }

    @Override
    public boolean isConfigured() {
        return client != null;
    }

    @Override
    public DeliveryOutcome send(String message) {
        if (client == null) {
            LOG.warnf("No notification webhook configured, dropping message: %s", message);
            return record(DeliveryOutcome.notConfigured());
        }

        try (Response response = client.post(new WebhookMessage(message))) {
            int status = response.getStatus();
            if (response.getStatusInfo().getFamily() == Response.Status.Family.SUCCESSFUL) {
                LOG.debugf("Webhook accepted notification with HTTP %d", status);
                return record(DeliveryOutcome.sent(status));
            }

            LOG.warnf("Webhook rejected notification with HTTP %d", status);
            return record(DeliveryOutcome.failed(status, "Webhook responded with HTTP " + status));

        } catch (RuntimeException e) {
            LOG.warnf(e, "Webhook delivery failed: %s", e.getMessage());
            return record(DeliveryOutcome.failed(null, "Webhook call failed: " + e.getMessage()));
        }
    }

    private DeliveryOutcome record(DeliveryOutcome outcome) {
        Counter.builder("trustlens_notifications_total")
                .description("Notification delivery attempts by outcome")
                .tag("outcome", outcome.status().getWireName())
                .register(meterRegistry)
                .increment();
        return outcome;
    }

    /**
     * Validates the configured webhook URL. Blank values and anything other than an
     * absolute http(s) URL disable delivery.
     */
    static Optional<URI> resolve(Optional<String> webhookUrl) {
        Optional<String> value = webhookUrl.map(String::trim).filter(s -> !s.isEmpty());
        if (value.isEmpty()) {
            return Optional.empty();
        }
        try {
            URI uri = URI.create(value.get());
            String scheme = uri.getScheme();
            if (uri.getHost() == null
                    || scheme == null
                    || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                LOG.errorf("Ignoring notification webhook URL without http(s) scheme and host: %s", uri);
                return Optional.empty();
            }
            return Optional.of(uri);
        } catch (IllegalArgumentException e) {
            LOG.errorf("Ignoring malformed notification webhook URL: %s", e.getMessage());
            return Optional.empty();
        }
    }

    private static WebhookClient buildClient(URI uri, Duration timeout) {
        LOG.infof("Notification webhook configured for host %s", uri.getHost());
        return RestClientBuilder.newBuilder()
                .baseUri(uri)
                .connectTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .property(DISABLE_DEFAULT_MAPPER, true)
                .build(WebhookClient.class);
    }
}
