package com.di.moduleflow.model;

/**
 * How often data lands in a target. Echoed into every status report.
 */
public enum DataFrequency {
    MILESTONE,
    DAILY
}
