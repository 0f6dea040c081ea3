/* (C)2026 */
package com.ammann.trustlens.service;

import com.ammann.trustlens.dto.MetricsResultDTO;
import com.ammann.trustlens.model.AlertThresholds;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Compares quality metrics against thresholds and produces human-readable alert messages.
 *
 * <p>The null-rate rule is always evaluated before the staleness rule, so when both fire the
 * null-rate alert comes first. Missing metric values never raise an alert.
 */
@ApplicationScoped
public class AlertEvaluationService {

    /**
     * Evaluates the alert rules.
     *
     * @param metrics computed metrics
     * @param thresholds limits to compare against
     * @return alert messages in rule order, possibly empty
     */
    public List<String> evaluate(MetricsResultDTO metrics, AlertThresholds thresholds) {
        List<String> alerts = new ArrayList<>(2);

        Double nullRate = metrics.nullRate();
        if (nullRate != null && nullRate > thresholds.nullThreshold()) {
            alerts.add(String.format(Locale.ROOT, "High null rate: %.1f%%", nullRate * 100));
        }

        Long minutes = metrics.minutesSinceLastUpdate();
        if (minutes != null && minutes > thresholds.minutesThreshold()) {
            alerts.add(String.format(Locale.ROOT, "Data stale: %d minutes since last update", minutes));
        }

        return List.copyOf(alerts);
    }
}
