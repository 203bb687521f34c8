package com.di.moduleflow.pipeline;

/**
 * Thrown inside the append path when storage reports an unsuccessful write. Always caught by
 * {@link AppendWriter} and turned into a FAILED report.
 */
public class WriteFailureException extends RuntimeException {

    public WriteFailureException(String message) {
        super(message);
    }
}
