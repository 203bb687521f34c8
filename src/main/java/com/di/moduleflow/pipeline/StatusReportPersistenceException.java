package com.di.moduleflow.pipeline;

/**
 * Thrown when a status report could not be written to the status log. Not converted into a
 * module status: without a durable report there is nothing to record it in.
 */
public class StatusReportPersistenceException extends RuntimeException {

    public StatusReportPersistenceException(String message) {
        super(message);
    }
}
