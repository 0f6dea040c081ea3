/* (C)2026 */
package com.ammann.trustlens.model;

import com.ammann.trustlens.enumeration.ColumnType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named, typed column of a {@link Dataset}.
 *
 * <p>Cells are nullable; {@code null} is the missing-value marker. Every non-null cell must
 * be an instance of the Java type associated with the column's {@link ColumnType}.
 *
 * @param name column name, unique within a dataset
 * @param type inferred value type
 * @param cells cell values in row order
 */
public record DatasetColumn(String name, ColumnType type, List<Object> cells) {

    public DatasetColumn {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(cells, "cells");
        for (Object cell : cells) {
            if (cell != null && !type.accepts(cell)) {
                throw new IllegalArgumentException(
                        String.format(
                                "Column '%s' of type %s cannot hold value of type %s",
                                name, type, cell.getClass().getSimpleName()));
            }
        }
        // List.copyOf rejects nulls
        cells = Collections.unmodifiableList(new ArrayList<>(cells));
    }

    /**
     * @return number of cells (rows) in this column
     */
    public int size() {
        return cells.size();
    }

    /**
     * @return number of missing cells
     */
    public long nullCount() {
        return cells.stream().filter(Objects::isNull).count();
    }

    /**
     * Returns the cell at the given 0-based row index.
     */
    public Object cell(int row) {
        return cells.get(row);
    }
}
