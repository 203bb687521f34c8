package com.di.moduleflow.model;

/**
 * Identity of one pipeline stage. The incremental window a module is responsible for is
 * resolved per run through {@link com.di.moduleflow.config.PipelineConfig#fromTime(int)} and
 * {@link com.di.moduleflow.config.PipelineConfig#untilTime(int)}.
 *
 * @param moduleId   unique module number (e.g. 1010)
 * @param moduleName human-readable name used in logs and status reports
 */
public record Module(int moduleId, String moduleName) {

    public Module {
        if (moduleName == null || moduleName.isBlank()) {
            throw new IllegalArgumentException("Module name cannot be null or empty");
        }
    }

    /** {@code <id>-<name>}, the form used in log lines. */
    public String label() {
        return moduleId + "-" + moduleName;
    }
}
