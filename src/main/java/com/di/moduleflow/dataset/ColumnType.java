package com.di.moduleflow.dataset;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Logical column types a minimum schema can require.
 */
public enum ColumnType {

    STRING(String.class),
    INTEGER(Integer.class),
    LONG(Long.class),
    DOUBLE(Double.class),
    BOOLEAN(Boolean.class),
    DATE(LocalDate.class),
    TIMESTAMP(Instant.class),
    /** Any value is accepted; only presence (and nullability) is checked. */
    ANY(Object.class);

    private final Class<?> javaType;

    ColumnType(Class<?> javaType) {
        this.javaType = javaType;
    }

    public Class<?> getJavaType() {
        return javaType;
    }

    /**
     * Whether a non-null value fits this type. Integral values are widened: an INTEGER fits a
     * LONG column.
     */
    public boolean accepts(Object value) {
        if (value == null || this == ANY) return true;
        if (this == LONG) return value instanceof Long || value instanceof Integer || value instanceof Short;
        if (this == DOUBLE) return value instanceof Number;
        return javaType.isInstance(value);
    }
}
