/* (C)2026 */
package com.ammann.trustlens.service;

import com.ammann.trustlens.dto.MetricsResultDTO;
import com.ammann.trustlens.exception.DatasetParseException;
import com.ammann.trustlens.model.Dataset;
import com.ammann.trustlens.model.DatasetColumn;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Service for assessing the quality of an ingested dataset.
 *
 * <p>Computes two signals:
 * <ul>
 *   <li><b>null rate</b> - missing cells divided by total cells over the data columns
 *       (every column except {@value #UPDATED_AT_COLUMN}), rounded to 3 decimals;</li>
 *   <li><b>freshness</b> - whole minutes between the most recent
 *       {@value #UPDATED_AT_COLUMN} value and the current time.</li>
 * </ul>
 *
 * <p>The result is a pure function of the dataset and the injected {@link Clock}.
 */
@ApplicationScoped
public class DataQualityService {

    private static final Logger LOG = Logger.getLogger(DataQualityService.class);

    /** Name of the column holding per-row update timestamps. */
    public static final String UPDATED_AT_COLUMN = "updated_at";

    static final int NULL_RATE_SCALE = 3;

    private final Clock clock;

    @Inject
    public DataQualityService(Clock clock) {
        this.clock = clock;
    }

    /**
     * Computes the quality metrics of a dataset.
     *
     * @param dataset dataset to assess
     * @return metrics; individual values are {@code null} when they cannot be computed
     * @throws DatasetParseException if an {@value #UPDATED_AT_COLUMN} value is not a timestamp
     */
    public MetricsResultDTO computeMetrics(Dataset dataset) {
        Double nullRate = computeNullRate(dataset);
        Long minutes = minutesSinceLastUpdate(dataset).orElse(null);

        LOG.debugf(
                "Quality metrics for %s: null_rate=%s, minutes_since_last_update=%s",
                dataset, nullRate, minutes);
        return new MetricsResultDTO(nullRate, minutes);
    }

    /**
     * Returns the fraction of null cells over the data columns, or {@code null} when there
     * are no data cells.
     */
    Double computeNullRate(Dataset dataset) {
        long cells = 0;
        long nulls = 0;
        for (DatasetColumn column : dataset.columns()) {
            if (UPDATED_AT_COLUMN.equals(column.name())) {
                continue;
            }
            cells += column.size();
            nulls += column.nullCount();
        }

        if (cells == 0) {
            return null;
        }
        return BigDecimal.valueOf((double) nulls / cells)
                .setScale(NULL_RATE_SCALE, RoundingMode.HALF_UP)
                .doubleValue();
    }

    /**
     * Returns whole minutes since the most recent update timestamp. Empty when the dataset has
     * no {@value #UPDATED_AT_COLUMN} column or the column holds no values. Timestamps in the
     * future count as zero minutes.
     */
    Optional<Long> minutesSinceLastUpdate(Dataset dataset) {
        Optional<DatasetColumn> column = dataset.column(UPDATED_AT_COLUMN);
        if (column.isEmpty()) {
            return Optional.empty();
        }

        Instant latest = null;
        DatasetColumn updatedAt = column.get();
        for (int row = 0; row < updatedAt.size(); row++) {
            Object cell = updatedAt.cell(row);
            if (cell == null) {
                continue;
            }
            Instant timestamp = toInstant(cell, row + 1);
            if (latest == null || timestamp.isAfter(latest)) {
                latest = timestamp;
            }
        }

        if (latest == null) {
            return Optional.empty();
        }
        long minutes = Duration.between(latest, clock.instant()).toMinutes();
        return Optional.of(Math.max(0L, minutes));
    }

    private static Instant toInstant(Object cell, int row) {
        if (cell instanceof Instant instant) {
            return instant;
        }
        try {
            return TimestampParser.parse(cell.toString());
        } catch (DateTimeParseException e) {
            throw DatasetParseException.unparseableTimestamp(UPDATED_AT_COLUMN, row, cell, e);
        }
    }
}
