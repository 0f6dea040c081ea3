/* (C)2026 */
package com.ammann.trustlens.service;

import com.ammann.trustlens.enumeration.ColumnType;
import com.ammann.trustlens.exception.DatasetParseException;
import com.ammann.trustlens.model.Dataset;
import com.ammann.trustlens.model.DatasetColumn;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import jakarta.enterprise.context.ApplicationScoped;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import org.jboss.logging.Logger;

/**
 * Parses uploaded CSV content into a typed {@link Dataset}.
 *
 * <p>The first record is the header. Empty fields and common missing-value tokens
 * ({@code NA}, {@code N/A}, {@code NaN}, {@code null}, {@code None}, ...) become null cells.
 * Records shorter than the header are padded with nulls; longer records are rejected.
 * Column types are inferred from the non-null cells, trying integer, decimal, boolean and
 * timestamp before falling back to text.
 */
@ApplicationScoped
public class CsvDatasetParser {

    private static final Logger LOG = Logger.getLogger(CsvDatasetParser.class);

    static final Set<String> NULL_TOKENS =
            Set.of("", "NA", "N/A", "n/a", "NaN", "nan", "null", "NULL", "None", "#N/A", "<NA>");

    private final CsvMapper csvMapper = new CsvMapper();

    /**
     * Parses CSV bytes (UTF-8) into a dataset.
     *
     * @param content raw upload content
     * @return the parsed dataset
     * @throws DatasetParseException if the content is empty, the header is invalid or a
     *     record has more fields than the header
     */
    public Dataset parse(byte[] content) {
        List<String[]> records = readRecords(content);
        if (records.isEmpty()) {
            throw new DatasetParseException("No columns to parse from file");
        }

        List<String> header = readHeader(records.get(0));
        int width = header.size();

        List<List<String>> raw = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            raw.add(new ArrayList<>(records.size() - 1));
        }

        for (int r = 1; r < records.size(); r++) {
            String[] fields = records.get(r);
            if (fields.length > width) {
                throw DatasetParseException.tooManyFields(r, width, fields.length);
            }
            for (int c = 0; c < width; c++) {
                raw.get(c).add(c < fields.length ? normalize(fields[c]) : null);
            }
        }

        List<DatasetColumn> columns = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            columns.add(toColumn(header.get(c), raw.get(c)));
        }

        Dataset dataset = Dataset.of(columns);
        LOG.debugf("Parsed CSV upload into %s", dataset);
        return dataset;
    }

    private List<String[]> readRecords(byte[] content) {
        if (content == null || content.length == 0) {
            return List.of();
        }
        List<String[]> records = new ArrayList<>();
        try (MappingIterator<String[]> iterator =
                csvMapper
                        .readerFor(String[].class)
                        .with(CsvParser.Feature.WRAP_AS_ARRAY)
                        .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                        .readValues(content)) {
            while (iterator.hasNextValue()) {
                records.add(iterator.nextValue());
            }
        } catch (IOException e) {
            int row = Math.max(records.size(), 1);
            throw new DatasetParseException(
                    String.format("Malformed CSV near row %d: %s", row, e.getMessage()),
                    row,
                    null,
                    e);
        }
        return records;
    }

    private List<String> readHeader(String[] headerRecord) {
        List<String> header = new ArrayList<>(headerRecord.length);
        Set<String> seen = new HashSet<>();
        for (int c = 0; c < headerRecord.length; c++) {
            String name = headerRecord[c] == null ? "" : headerRecord[c].trim();
            if (name.isEmpty()) {
                throw new DatasetParseException(
                        String.format("Blank column name at position %d", c + 1), 0, null, null);
            }
            if (!seen.add(name)) {
                throw new DatasetParseException(
                        String.format("Duplicate column name '%s'", name), 0, name, null);
            }
            header.add(name);
        }
        return header;
    }

    private static String normalize(String field) {
        if (field == null) {
            return null;
        }
        String trimmed = field.trim();
        return NULL_TOKENS.contains(trimmed) ? null : trimmed;
    }

    static DatasetColumn toColumn(String name, List<String> values) {
        List<String> present = values.stream().filter(v -> v != null).toList();
        ColumnType type = inferType(present);
        Function<String, Object> converter = converterFor(type);

        List<Object> cells = new ArrayList<>(values.size());
        for (String value : values) {
            cells.add(value == null ? null : converter.apply(value));
        }
        return new DatasetColumn(name, type, cells);
    }

    static ColumnType inferType(List<String> present) {
        if (present.isEmpty()) {
            return ColumnType.TEXT;
        }
        if (all(present, CsvDatasetParser::isInteger)) {
            return ColumnType.INTEGER;
        }
        if (all(present, CsvDatasetParser::isDecimal)) {
            return ColumnType.DECIMAL;
        }
        if (all(present, CsvDatasetParser::isBoolean)) {
            return ColumnType.BOOLEAN;
        }
        if (all(present, TimestampParser::isParseable)) {
            return ColumnType.TIMESTAMP;
        }
        return ColumnType.TEXT;
    }

    private static Function<String, Object> converterFor(ColumnType type) {
        return switch (type) {
            case INTEGER -> Long::valueOf;
            case DECIMAL -> Double::valueOf;
            case BOOLEAN -> value -> Boolean.valueOf(value.toLowerCase(Locale.ROOT));
            case TIMESTAMP -> TimestampParser::parse;
            case TEXT -> value -> value;
        };
    }

    private static boolean all(List<String> values, Predicate<String> predicate) {
        return values.stream().allMatch(predicate);
    }

    private static boolean isInteger(String value) {
        try {
            Long.parseLong(value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static boolean isDecimal(String value) {
        try {
            double parsed = Double.parseDouble(value);
            return Double.isFinite(parsed);
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static boolean isBoolean(String value) {
        return "true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value);
    }
}
