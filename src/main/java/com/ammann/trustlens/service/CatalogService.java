/* (C)2026 */
package com.ammann.trustlens.service;

import com.ammann.trustlens.dto.AlertRecordDTO;
import com.ammann.trustlens.dto.DataSourceDTO;
import com.ammann.trustlens.dto.TrendPointDTO;
import com.ammann.trustlens.enumeration.AlertSeverity;
import com.ammann.trustlens.enumeration.SourceStatus;
import com.ammann.trustlens.exception.ValidationException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-side catalog backing the dashboard: monitored data sources, alert history and the
 * null-rate / freshness trend.
 *
 * <p>All collections are fixed or deterministically generated; nothing here reads the
 * {@link com.ammann.trustlens.store.TabularStore}.
 */
@ApplicationScoped
public class CatalogService {

    static final int MAX_TREND_POINTS = 1440;
    static final String DEFAULT_WINDOW = "30min";

    private static final Pattern WINDOW_PATTERN =
            Pattern.compile("^(\\d{1,5})\\s*(m|min|mins|minutes|h|hr|hour|hours)$");
    private static final DateTimeFormatter MINUTE_LABEL =
            DateTimeFormatter.ofPattern("HH:mm").withZone(ZoneOffset.UTC);

    private final Clock clock;
    private final List<DataSourceDTO> dataSources;
    private final List<AlertRecordDTO> alerts;

    @Inject
    public CatalogService(Clock clock) {
        this.clock = clock;
        Instant startedAt = clock.instant();

        this.dataSources =
                List.of(
                        new DataSourceDTO("1", "Orders DB", "postgres", SourceStatus.HEALTHY, startedAt),
                        new DataSourceDTO("2", "Users API", "api", SourceStatus.WARNING, startedAt),
                        new DataSourceDTO("3", "Inventory S3", "s3", SourceStatus.FAILING, startedAt),
                        new DataSourceDTO(
                                "4", "Billing Warehouse", "postgres", SourceStatus.HEALTHY, startedAt));

        this.alerts =
                List.of(
                        new AlertRecordDTO(1, AlertSeverity.HIGH, "Orders freshness > 60 min", startedAt),
                        new AlertRecordDTO(2, AlertSeverity.MEDIUM, "Email NULL rate spiked", startedAt),
                        new AlertRecordDTO(3, AlertSeverity.LOW, "Inventory sync delayed", startedAt));
    }

    public List<DataSourceDTO> listDataSources() {
        return dataSources;
    }

    /**
     * Returns the most recent alerts.
     *
     * @param limit maximum number of alerts, non-negative
     * @return at most {@code limit} alerts
     */
    public List<AlertRecordDTO> listAlerts(int limit) {
        if (limit < 0) {
            throw ValidationException.invalidParameter("limit", limit, "non-negative integer");
        }
        return alerts.subList(0, Math.min(limit, alerts.size()));
    }

    /**
     * Generates the synthetic null-rate trend: one point per minute of the window, ending at
     * the current minute.
     *
     * @param window window such as {@code 30min} or {@code 2h}; {@code null} means 30 minutes
     * @return trend points in chronological order
     */
    public List<TrendPointDTO> nullRateTrend(String window) {
        int points = parseWindowMinutes(window);
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);

        List<TrendPointDTO> trend = new ArrayList<>(points);
        for (int i = 0; i < points; i++) {
            Instant ts = now.minus(points - 1L - i, ChronoUnit.MINUTES);
            double nullRate =
                    BigDecimal.valueOf(((i * 7) % 21) + (i % 3) * 0.3)
                            .setScale(1, RoundingMode.HALF_UP)
                            .doubleValue();
            int freshness = (i * 4) % 120 + 5;
            trend.add(new TrendPointDTO(MINUTE_LABEL.format(ts), nullRate, freshness));
        }
        return trend;
    }

    static int parseWindowMinutes(String window) {
        if (window == null || window.isBlank()) {
            window = DEFAULT_WINDOW;
        }
        Matcher matcher = WINDOW_PATTERN.matcher(window.trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw ValidationException.invalidParameter("window", window, "duration such as 30min or 2h");
        }

        long amount = Long.parseLong(matcher.group(1));
        long minutes = matcher.group(2).startsWith("h") ? amount * 60 : amount;
        if (minutes <= 0) {
            throw ValidationException.invalidParameter("window", window, "positive duration");
        }
        return (int) Math.min(minutes, MAX_TREND_POINTS);
    }
}
