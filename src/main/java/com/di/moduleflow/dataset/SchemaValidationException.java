package com.di.moduleflow.dataset;

import lombok.Getter;

import java.util.List;

/**
 * Thrown by {@link Dataset#verifyMinimumSchema} when a source does not satisfy the module's
 * minimum schema. Fatal for the module; routed through the failure path.
 */
@Getter
public class SchemaValidationException extends RuntimeException {

    private final List<String> violations;

    public SchemaValidationException(List<String> violations) {
        super("Minimum schema verification failed: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }
}
