package com.ammann.trustlens.enumeration;

/**
 * Value type of a dataset column, inferred from the non-null cells at ingest time.
 *
 * <p>Cell values are stored as {@link Long}, {@link Double}, {@link Boolean},
 * {@link java.time.Instant} or {@link String} respectively.
 */
public enum ColumnType
{
    INTEGER(Long.class),
    DECIMAL(Double.class),
    BOOLEAN(Boolean.class),
    TIMESTAMP(java.time.Instant.class),
    TEXT(String.class);

    private final Class<?> javaType;

    ColumnType(Class<?> javaType) {
        this.javaType = javaType;
    }

    /**
     * Returns whether the given non-null cell value is acceptable for this column type.
     *
     * @param value cell value, never {@code null}
     * @return {@code true} if the value is an instance of this type's Java representation
     */
    public boolean accepts(Object value) {
        return javaType.isInstance(value);
    }

    public Class<?> getJavaType() { return javaType; }
}
