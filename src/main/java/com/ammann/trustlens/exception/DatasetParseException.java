package com.ammann.trustlens.exception;

/**
 * Exception indicating that tabular content could not be interpreted: a malformed CSV upload
 * or a freshness timestamp that cannot be parsed.
 *
 * <p>Carries the 1-based data row and the column name where the failure was located, when
 * known. Mapped to HTTP 400 (Bad Request) with code {@code PARSE_ERROR} by
 * {@link GlobalExceptionHandler}.
 */
public class DatasetParseException extends ApiException
{
    private final Integer row;
    private final String column;

    public DatasetParseException(String message, Integer row, String column, Throwable cause)
    {
        super(message, cause);
        this.row = row;
        this.column = column;
    }

    public DatasetParseException(String message)
    {
        this(message, null, null, null);
    }

    /**
     * Creates a parse exception for a cell that holds an unparseable timestamp.
     */
    public static DatasetParseException unparseableTimestamp(String column, int row, Object value, Throwable cause)
    {
        return new DatasetParseException(
                String.format("Unparseable timestamp '%s' in column '%s' at row %d", value, column, row),
                row, column, cause);
    }

    /**
     * Creates a parse exception for a CSV record that has more fields than the header.
     */
    public static DatasetParseException tooManyFields(int row, int expected, int actual)
    {
        return new DatasetParseException(
                String.format("Expected %d fields in row %d, saw %d", expected, row, actual),
                row, null, null);
    }

    public Integer getRow()
    {
        return row;
    }

    public String getColumn()
    {
        return column;
    }
}
