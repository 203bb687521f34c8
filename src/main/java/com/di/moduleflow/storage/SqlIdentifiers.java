package com.di.moduleflow.storage;

import lombok.extern.slf4j.Slf4j;

import java.util.regex.Pattern;

/**
 * Validation of SQL identifiers that {@link JdbcDatabase} splices into statements. Table and
 * column names come from pipeline configuration and row keys, never from bind parameters, so
 * they are checked before any statement is built.
 */
@Slf4j
public final class SqlIdentifiers {

    private SqlIdentifiers() {}

    // ============================================================================
    // Patterns
    // ============================================================================

    /**
     * Unquoted identifier: starts with a letter or underscore, followed by letters, digits,
     * underscores or dollar signs. 63 characters max (PostgreSQL limit).
     */
    private static final Pattern VALID_IDENTIFIER_PATTERN = Pattern.compile(
            "^[a-zA-Z_][a-zA-Z0-9_$]{0,62}$"
    );

    /** Whole-word SQL keywords. Word boundaries keep names like {@code organization_id} legal. */
    private static final Pattern SQL_KEYWORD_PATTERN = Pattern.compile(
            "(?i)\\b(SELECT|INSERT|UPDATE|DELETE|DROP|CREATE|ALTER|TRUNCATE|EXEC|EXECUTE|UNION|OR|AND)\\b"
    );

    /** Comments, statement terminators and quotes. */
    private static final Pattern SQL_SYMBOL_PATTERN = Pattern.compile("(--|/\\*|\\*/|;|'|\")");

    private static final int MAX_IDENTIFIER_LENGTH = 63;

    // ============================================================================
    // Validation
    // ============================================================================

    /**
     * Validates a single identifier (schema, table or column name).
     *
     * @param identifier     the identifier
     * @param identifierType used in error messages (e.g. "column name")
     * @return the trimmed identifier
     * @throws IllegalArgumentException if validation fails
     */
    public static String validateIdentifier(String identifier, String identifierType) {
        if (identifier == null) {
            throw new IllegalArgumentException(String.format("%s cannot be null", identifierType));
        }
        String trimmed = identifier.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(String.format("%s cannot be empty", identifierType));
        }
        if (trimmed.length() > MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException(
                    String.format("%s exceeds maximum length of %d characters: %s",
                            identifierType, MAX_IDENTIFIER_LENGTH, trimmed));
        }
        if (SQL_KEYWORD_PATTERN.matcher(trimmed).find() || SQL_SYMBOL_PATTERN.matcher(trimmed).find()) {
            log.warn("Potential SQL injection attempt detected in {}: {}", identifierType, trimmed);
            throw new IllegalArgumentException(
                    String.format("Invalid %s: contains potentially dangerous SQL patterns: '%s'",
                            identifierType, trimmed));
        }
        if (!VALID_IDENTIFIER_PATTERN.matcher(trimmed).matches()) {
            throw new IllegalArgumentException(
                    String.format("Invalid %s format: '%s'. "
                            + "Must start with a letter or underscore, followed by letters, digits, underscores, or dollar signs.",
                            identifierType, trimmed));
        }
        return trimmed;
    }

    /**
     * Validates {@code table} or {@code schema.table}.
     */
    public static String validateTableName(String tableName) {
        if (tableName == null || tableName.isBlank()) {
            throw new IllegalArgumentException("Table name cannot be null or empty");
        }
        String trimmed = tableName.trim();
        String[] parts = trimmed.split("\\.", -1);
        if (parts.length > 2) {
            throw new IllegalArgumentException("Table name may have at most one schema qualifier: " + trimmed);
        }
        for (String part : parts) {
            validateIdentifier(part, parts.length == 2 ? "schema-qualified table name part" : "table name");
        }
        return trimmed;
    }

    public static String validateColumnName(String columnName) {
        return validateIdentifier(columnName, "column name");
    }
}
