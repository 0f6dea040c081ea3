/* (C)2026 */
package com.ammann.trustlens.service;

import static com.ammann.trustlens.support.TestDataFactory.csv;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.trustlens.enumeration.ColumnType;
import com.ammann.trustlens.exception.DatasetParseException;
import com.ammann.trustlens.model.Dataset;
import com.ammann.trustlens.model.DatasetColumn;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link CsvDatasetParser}.
 *
 * <p>Covers header handling, missing-value tokens, ragged records and column type
 * inference.
 */
class CsvDatasetParserTest {

    private final CsvDatasetParser parser = new CsvDatasetParser();

    @Test
    void parsesHeaderAndTypedColumns() {
        Dataset dataset =
                parser.parse(
                        csv(
                                "id,value,name,active,updated_at",
                                "1,10.5,alpha,true,2025-09-01",
                                "2,,beta,false,2025-09-08T10:00:00Z",
                                "3,30,,TRUE,2025-09-09 08:30"));

        assertThat(dataset.columnNames())
                .containsExactly("id", "value", "name", "active", "updated_at");
        assertThat(dataset.rowCount()).isEqualTo(3);

        assertThat(column(dataset, "id").type()).isEqualTo(ColumnType.INTEGER);
        assertThat(column(dataset, "id").cells()).containsExactly(1L, 2L, 3L);
        assertThat(column(dataset, "value").type()).isEqualTo(ColumnType.DECIMAL);
        assertThat(column(dataset, "value").cells()).containsExactly(10.5, null, 30.0);
        assertThat(column(dataset, "name").type()).isEqualTo(ColumnType.TEXT);
        assertThat(column(dataset, "name").nullCount()).isEqualTo(1);
        assertThat(column(dataset, "active").type()).isEqualTo(ColumnType.BOOLEAN);
        assertThat(column(dataset, "updated_at").type()).isEqualTo(ColumnType.TIMESTAMP);
        assertThat(column(dataset, "updated_at").cell(2))
                .isEqualTo(Instant.parse("2025-09-09T08:30:00Z"));
    }

    @Test
    void treatsMissingValueTokensAsNull() {
        Dataset dataset = parser.parse(csv("a,b", "NA,null", "NaN,N/A", "None, "));

        assertThat(column(dataset, "a").nullCount()).isEqualTo(3);
        assertThat(column(dataset, "b").nullCount()).isEqualTo(3);
        assertThat(column(dataset, "a").type()).isEqualTo(ColumnType.TEXT);
    }

    @Test
    void padsShortRecordsWithNulls() {
        Dataset dataset = parser.parse(csv("a,b,c", "1,2,3", "4"));

        assertThat(dataset.rowCount()).isEqualTo(2);
        assertThat(column(dataset, "b").cells()).containsExactly(2L, null);
        assertThat(column(dataset, "c").cells()).containsExactly(3L, null);
    }

    @Test
    void skipsBlankLines() {
        Dataset dataset = parser.parse(csv("value", "10", "", "30"));

        assertThat(dataset.rowCount()).isEqualTo(2);
        assertThat(column(dataset, "value").cells()).containsExactly(10L, 30L);
        assertThat(column(dataset, "value").nullCount()).isZero();
    }

    @Test
    void parsesOffsetTimestampsWrittenWithSpaceSeparator() {
        Dataset dataset =
                parser.parse(
                        csv(
                                "value,updated_at",
                                "1,2025-09-09 10:00:00+00:00",
                                "2,2025-09-09 12:30:00+02:00"));

        assertThat(column(dataset, "updated_at").type()).isEqualTo(ColumnType.TIMESTAMP);
        assertThat(column(dataset, "updated_at").cells())
                .containsExactly(
                        Instant.parse("2025-09-09T10:00:00Z"), Instant.parse("2025-09-09T10:30:00Z"));
    }

    @Test
    void headerOnlyYieldsEmptyDataset() {
        Dataset dataset = parser.parse(csv("a,b"));

        assertThat(dataset.rowCount()).isZero();
        assertThat(dataset.columnNames()).containsExactly("a", "b");
    }

    @Test
    void handlesQuotedFields() {
        Dataset dataset = parser.parse(csv("id,comment", "1,\"hello, world\""));

        assertThat(column(dataset, "comment").cells()).containsExactly("hello, world");
    }

    @Test
    void rejectsRecordWithTooManyFields() {
        assertThatThrownBy(() -> parser.parse(csv("a,b", "1,2", "3,4,5")))
                .isInstanceOf(DatasetParseException.class)
                .hasMessageContaining("row 2")
                .extracting(e -> ((DatasetParseException) e).getRow())
                .isEqualTo(2);
    }

    @Test
    void rejectsEmptyContent() {
        assertThatThrownBy(() -> parser.parse(new byte[0]))
                .isInstanceOf(DatasetParseException.class)
                .hasMessageContaining("No columns");
    }

    @Test
    void rejectsDuplicateHeader() {
        assertThatThrownBy(() -> parser.parse(csv("a,a", "1,2")))
                .isInstanceOf(DatasetParseException.class)
                .extracting(e -> ((DatasetParseException) e).getColumn())
                .isEqualTo("a");
    }

    @Test
    void rejectsBlankHeader() {
        assertThatThrownBy(() -> parser.parse(csv("a,,c", "1,2,3")))
                .isInstanceOf(DatasetParseException.class)
                .hasMessageContaining("position 2");
    }

    @Test
    void inferTypeFallsBackToTextForMixedValues() {
        assertThat(CsvDatasetParser.inferType(List.of("1", "2025-09-01"))).isEqualTo(ColumnType.TEXT);
        assertThat(CsvDatasetParser.inferType(List.of("1", "2.5"))).isEqualTo(ColumnType.DECIMAL);
        assertThat(CsvDatasetParser.inferType(List.of())).isEqualTo(ColumnType.TEXT);
    }

    private static DatasetColumn column(Dataset dataset, String name) {
        return dataset.column(name).orElseThrow();
    }
}
