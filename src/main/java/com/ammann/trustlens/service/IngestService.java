/* (C)2026 */
package com.ammann.trustlens.service;

import com.ammann.trustlens.dto.IngestSummaryDTO;
import com.ammann.trustlens.enumeration.ColumnType;
import com.ammann.trustlens.model.Dataset;
import com.ammann.trustlens.model.DatasetColumn;
import com.ammann.trustlens.properties.ApiProperties;
import com.ammann.trustlens.store.TabularStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Loads datasets into the {@link TabularStore}, either from an uploaded CSV file or from the
 * built-in demo fixture.
 */
@ApplicationScoped
public class IngestService {

    private static final Logger LOG = Logger.getLogger(IngestService.class);

    private final TabularStore store;
    private final CsvDatasetParser csvParser;
    private final MeterRegistry meterRegistry;

    @Inject
    public IngestService(TabularStore store, CsvDatasetParser csvParser, MeterRegistry meterRegistry) {
        this.store = store;
        this.csvParser = csvParser;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Parses CSV content and stores it under the {@code csv} source key.
     *
     * @param content raw CSV bytes
     * @return summary of the stored dataset
     * @throws com.ammann.trustlens.exception.DatasetParseException if the content is malformed
     */
    public IngestSummaryDTO ingestCsv(byte[] content) {
        Dataset dataset = csvParser.parse(content);
        return store(ApiProperties.CSV_SOURCE, dataset);
    }

    /**
     * Stores the fixed three-row demo dataset under the {@code demo} source key.
     *
     * @return summary of the stored dataset
     */
    public IngestSummaryDTO ingestDemo() {
        return store(ApiProperties.DEMO_SOURCE, demoDataset());
    }

    /**
     * Returns the demo fixture: ids 1..3, one missing {@code value} and three
     * {@code updated_at} dates in September 2025.
     */
    public static Dataset demoDataset() {
        return Dataset.of(
                List.of(
                        new DatasetColumn("id", ColumnType.INTEGER, List.<Object>of(1L, 2L, 3L)),
                        new DatasetColumn("value", ColumnType.INTEGER, Arrays.<Object>asList(10L, null, 30L)),
                        new DatasetColumn(
                                DataQualityService.UPDATED_AT_COLUMN,
                                ColumnType.TIMESTAMP,
                                List.<Object>of(
                                        midnightUtc(2025, 9, 1),
                                        midnightUtc(2025, 9, 8),
                                        midnightUtc(2025, 9, 9)))));
    }

    private static Instant midnightUtc(int year, int month, int day) {
        return LocalDate.of(year, month, day).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    private IngestSummaryDTO store(String source, Dataset dataset) {
        store.put(source, dataset);
        Counter.builder("trustlens_ingest_total")
                .description("Datasets ingested")
                .tag("source", source)
                .register(meterRegistry)
                .increment();

        LOG.infof(
                "Ingested dataset for source '%s': %d rows, columns=%s",
                source, dataset.rowCount(), dataset.columnNames());
        return new IngestSummaryDTO(source, dataset.rowCount(), dataset.columnNames());
    }
}
