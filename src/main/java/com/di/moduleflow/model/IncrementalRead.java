package com.di.moduleflow.model;

/**
 * Describes how to slice a target back down to one run's window.
 *
 * @param dateColumn         partition-friendly date column, used to prune
 * @param epochMillisColumn  exact epoch-millis column the window is filtered on
 * @param additionalLagDays  extra days of date partitions to include before {@code from}
 */
public record IncrementalRead(String dateColumn, String epochMillisColumn, int additionalLagDays) {

    public IncrementalRead {
        if (epochMillisColumn == null || epochMillisColumn.isBlank()) {
            throw new IllegalArgumentException("epochMillisColumn cannot be null or empty");
        }
        if (additionalLagDays < 0) {
            throw new IllegalArgumentException("additionalLagDays must be >= 0, got " + additionalLagDays);
        }
    }
}
