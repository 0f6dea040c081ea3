/* (C)2026 */
package com.ammann.trustlens.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ammann.trustlens.enumeration.DeliveryStatus;
import com.ammann.trustlens.model.DeliveryOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.core.Response;
import java.net.URI;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class WebhookNotificationSinkTest {

    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
    }

    @Nested
    @DisplayName("without destination")
    class NotConfigured {

        @Test
        void reportsNotConfigured() {
            WebhookNotificationSink sink = new WebhookNotificationSink((WebhookClient) null, meterRegistry);

            DeliveryOutcome outcome = sink.send("hello");

            assertThat(sink.isConfigured()).isFalse();
            assertThat(outcome.status()).isEqualTo(DeliveryStatus.NOT_CONFIGURED);
            assertThat(outcome.delivered()).isFalse();
            assertThat(counter("not_configured")).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("with destination")
    class Configured {

        private WebhookClient client;
        private WebhookNotificationSink sink;

        @BeforeEach
        void setUp() {
            client = mock(WebhookClient.class);
            sink = new WebhookNotificationSink(client, meterRegistry);
        }

        @Test
        void postsTextPayloadAndReportsSent() {
            Response ok = response(Response.Status.OK);
            when(client.post(any())).thenReturn(ok);

            DeliveryOutcome outcome = sink.send("hello");

            verify(client).post(new WebhookMessage("hello"));
            assertThat(outcome).isEqualTo(DeliveryOutcome.sent(200));
            assertThat(counter("sent")).isEqualTo(1.0);
        }

        @Test
        void nonSuccessStatusIsFailure() {
            Response forbidden = response(Response.Status.FORBIDDEN);
            when(client.post(any())).thenReturn(forbidden);

            DeliveryOutcome outcome = sink.send("hello");

            assertThat(outcome.status()).isEqualTo(DeliveryStatus.FAILED);
            assertThat(outcome.httpStatus()).isEqualTo(403);
            assertThat(outcome.detail()).contains("403");
        }

        @Test
        void transportErrorIsFailureNotException() {
            when(client.post(any())).thenThrow(new ProcessingException("Connection refused"));

            DeliveryOutcome outcome = sink.send("hello");

            assertThat(outcome.status()).isEqualTo(DeliveryStatus.FAILED);
            assertThat(outcome.httpStatus()).isNull();
            assertThat(outcome.detail()).contains("Connection refused");
            assertThat(counter("failed")).isEqualTo(1.0);
        }
    }

    @Test
    void resolveAcceptsOnlyAbsoluteHttpUrls() {
        assertThat(WebhookNotificationSink.resolve(Optional.empty())).isEmpty();
        assertThat(WebhookNotificationSink.resolve(Optional.of("  "))).isEmpty();
        assertThat(WebhookNotificationSink.resolve(Optional.of("not a url"))).isEmpty();
        assertThat(WebhookNotificationSink.resolve(Optional.of("ftp://example.com/hook"))).isEmpty();
        assertThat(WebhookNotificationSink.resolve(Optional.of("https://hooks.example.com/services/T/B/X")))
                .contains(URI.create("https://hooks.example.com/services/T/B/X"));
    }

    private double counter(String outcome) {
        return meterRegistry.get("trustlens_notifications_total").tag("outcome", outcome).counter().count();
    }

    private static Response response(Response.Status status) {
        Response response = mock(Response.class);
        when(response.getStatus()).thenReturn(status.getStatusCode());
        when(response.getStatusInfo()).thenReturn(status);
        return response;
    }
}
