/* (C)2026 */
package com.ammann.trustlens.service;

import com.ammann.trustlens.dto.AlertTriggerResponseDTO;
import com.ammann.trustlens.dto.MetricsCheckResponseDTO;
import com.ammann.trustlens.dto.MetricsResultDTO;
import com.ammann.trustlens.dto.TestAlertResponseDTO;
import com.ammann.trustlens.model.AlertThresholds;
import com.ammann.trustlens.model.Dataset;
import com.ammann.trustlens.model.DeliveryOutcome;
import com.ammann.trustlens.notification.NotificationSink;
import com.ammann.trustlens.store.TabularStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Orchestrates metrics checks and alert triggering for ingested sources.
 *
 * <p>A trigger looks the source up in the {@link TabularStore}, computes its metrics,
 * evaluates the alert rules and, only when at least one alert fires, sends a single combined
 * message through the {@link NotificationSink}. Unknown sources are reported as a structured
 * result without touching the downstream components. A failed delivery never hides the
 * computed alerts.
 */
@ApplicationScoped
public class AlertTriggerService {

    private static final Logger LOG = Logger.getLogger(AlertTriggerService.class);

    static final String TEST_MESSAGE = "🚨 Test alert from TrustLens API";

    private final TabularStore store;
    private final DataQualityService dataQualityService;
    private final AlertEvaluationService alertEvaluationService;
    private final NotificationSink notificationSink;
    private final MeterRegistry meterRegistry;

    @Inject
    public AlertTriggerService(
            TabularStore store,
            DataQualityService dataQualityService,
            AlertEvaluationService alertEvaluationService,
            NotificationSink notificationSink,
            MeterRegistry meterRegistry) {
        this.store = store;
        this.dataQualityService = dataQualityService;
        this.alertEvaluationService = alertEvaluationService;
        this.notificationSink = notificationSink;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Computes the quality metrics of an ingested source.
     *
     * @param source source key
     * @return metrics, or an error result if the source was never ingested
     */
    public MetricsCheckResponseDTO checkMetrics(String source) {
        Optional<Dataset> dataset = store.get(source);
        if (dataset.isEmpty()) {
            LOG.debugf("Metrics requested for unknown source '%s'", source);
            return MetricsCheckResponseDTO.noData(source);
        }
        return MetricsCheckResponseDTO.of(source, dataQualityService.computeMetrics(dataset.get()));
    }

    /**
     * Evaluates alert rules for a source and notifies when any alert fires.
     *
     * @param source source key
     * @param thresholds limits to compare against
     * @return raised alerts with the delivery outcome, an all-clear result, or an error
     *     result if the source was never ingested
     */
    public AlertTriggerResponseDTO trigger(String source, AlertThresholds thresholds) {
        Optional<Dataset> dataset = store.get(source);
        if (dataset.isEmpty()) {
            LOG.debugf("Alert trigger requested for unknown source '%s'", source);
            return AlertTriggerResponseDTO.noData(source);
        }

        MetricsResultDTO metrics = dataQualityService.computeMetrics(dataset.get());
        List<String> alerts = alertEvaluationService.evaluate(metrics, thresholds);

        if (alerts.isEmpty()) {
            LOG.infof("No alerts for source '%s' (%s)", source, thresholds);
            return AlertTriggerResponseDTO.allGood(source);
        }

        Counter.builder("trustlens_alerts_raised_total")
                .description("Alerts raised by trigger requests")
                .tag("source", source)
                .register(meterRegistry)
                .increment(alerts.size());

        DeliveryOutcome delivery = notificationSink.send(formatMessage(source, alerts));
        LOG.infof(
                "Raised %d alert(s) for source '%s', delivery=%s",
                alerts.size(), source, delivery.status().getWireName());
        return AlertTriggerResponseDTO.raised(source, alerts, delivery);
    }

    /**
     * Sends a fixed test message through the notification sink.
     */
    public TestAlertResponseDTO sendTestAlert() {
        DeliveryOutcome delivery = notificationSink.send(TEST_MESSAGE);
        LOG.infof("Test alert delivery: %s", delivery.status().getWireName());
        return new TestAlertResponseDTO(delivery.status(), TEST_MESSAGE, delivery);
    }

    /**
     * Builds the combined notification text: a header naming the source followed by one
     * alert per line.
     */
    static String formatMessage(String source, List<String> alerts) {
        return "⚠️ TrustLens Alert for " + source + ":\n" + String.join("\n", alerts);
    }
}
