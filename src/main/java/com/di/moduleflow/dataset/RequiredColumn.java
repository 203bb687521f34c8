package com.di.moduleflow.dataset;

/**
 * One column of a module's minimum schema.
 *
 * @param name     column name
 * @param type     required logical type
 * @param nullable when false and non-null enforcement is on, nulls fail validation; a missing
 *                 nullable column is added as all-null instead of failing
 */
public record RequiredColumn(String name, ColumnType type, boolean nullable) {

    public static RequiredColumn required(String name, ColumnType type) {
        return new RequiredColumn(name, type, false);
    }

    public static RequiredColumn optional(String name, ColumnType type) {
        return new RequiredColumn(name, type, true);
    }
}
