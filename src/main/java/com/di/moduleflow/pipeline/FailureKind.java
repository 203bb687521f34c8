package com.di.moduleflow.pipeline;

import com.di.moduleflow.dataset.SchemaValidationException;

/**
 * Why a module failed. Recorded on the {@link ModuleResult} and in logs; the persisted status
 * string carries the message, not the kind.
 * <p>Usage: {@code FailureKind kind = FailureKind.categorize(exception);}
 */
public enum FailureKind {

    SCHEMA_VALIDATION("Schema validation error", "Source failed minimum-schema verification"),
    WRITE_FAILURE("Write failure", "Storage reported an unsuccessful write"),
    UNHANDLED("Unhandled error", "Any other error raised while executing the module");

    private final String name;
    private final String description;

    FailureKind(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Walks the cause chain; first recognised type wins. */
    public static FailureKind categorize(Throwable exception) {
        for (Throwable t = exception; t != null; t = t.getCause()) {
            if (t instanceof SchemaValidationException) return SCHEMA_VALIDATION;
            if (t instanceof WriteFailureException) return WRITE_FAILURE;
        }
        return UNHANDLED;
    }

    @Override
    public String toString() {
        return name();
    }
}
