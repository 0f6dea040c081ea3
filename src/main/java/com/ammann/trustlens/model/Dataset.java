/* (C)2026 */
package com.ammann.trustlens.model;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable in-memory table: an ordered list of typed columns of equal length.
 *
 * <p>Datasets are created by the ingest service and owned by the
 * {@link com.ammann.trustlens.store.TabularStore}. A dataset is replaced wholesale on
 * re-ingest; it is never mutated in place.
 */
public final class Dataset {

    private final List<DatasetColumn> columns;
    private final int rowCount;

    private Dataset(List<DatasetColumn> columns, int rowCount) {
        this.columns = columns;
        this.rowCount = rowCount;
    }

    /**
     * Creates a dataset from the given columns.
     *
     * @param columns ordered columns; names must be unique and sizes equal
     * @return the dataset
     * @throws IllegalArgumentException if column names repeat or column lengths differ
     */
    public static Dataset of(List<DatasetColumn> columns) {
        List<DatasetColumn> copy = List.copyOf(columns);
        Set<String> names = new HashSet<>();
        int rows = copy.isEmpty() ? 0 : copy.get(0).size();

        for (DatasetColumn column : copy) {
            if (!names.add(column.name())) {
                throw new IllegalArgumentException("Duplicate column name: " + column.name());
            }
            if (column.size() != rows) {
                throw new IllegalArgumentException(
                        String.format(
                                "Column '%s' has %d cells, expected %d",
                                column.name(), column.size(), rows));
            }
        }
        return new Dataset(copy, rows);
    }

    public List<DatasetColumn> columns() {
        return columns;
    }

    public List<String> columnNames() {
        return columns.stream().map(DatasetColumn::name).toList();
    }

    public Optional<DatasetColumn> column(String name) {
        return columns.stream().filter(c -> c.name().equals(name)).findFirst();
    }

    public int rowCount() {
        return rowCount;
    }

    public int columnCount() {
        return columns.size();
    }

    @Override
    public String toString() {
        return "Dataset{columns=" + columnNames() + ", rows=" + rowCount + "}";
    }
}
