package com.di.moduleflow.dataset;

import java.util.List;

/**
 * Minimum schema a module's source must satisfy before transforms run. Extra source columns
 * are always allowed.
 */
public record RequiredSchema(List<RequiredColumn> columns) {

    private static final RequiredSchema EMPTY = new RequiredSchema(List.of());

    public RequiredSchema {
        columns = List.copyOf(columns);
    }

    public static RequiredSchema empty() {
        return EMPTY;
    }

    public static RequiredSchema of(RequiredColumn... columns) {
        return new RequiredSchema(List.of(columns));
    }

    public boolean isEmpty() {
        return columns.isEmpty();
    }
}
