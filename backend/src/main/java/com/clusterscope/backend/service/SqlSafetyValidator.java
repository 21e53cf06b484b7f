package com.clusterscope.backend.service;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Accepts read-only statements for user-defined functions.
 */
public final class SqlSafetyValidator {

    private static final List<String> FORBIDDEN = List.of(
            "DROP", "DELETE", "UPDATE", "INSERT", "ALTER", "CREATE", "TRUNCATE",
            "EXEC", "EXECUTE", "CALL", "GRANT", "REVOKE", "COMMIT", "ROLLBACK"
    );

    private static final List<Pattern> FORBIDDEN_WORDS = FORBIDDEN.stream()
            .map(k -> Pattern.compile("\\b" + k + "\\b"))
            .toList();

    private SqlSafetyValidator() {
    }

    /**
     * @throws IllegalArgumentException when the statement is not a plain SELECT or SHOW
     */
    public static void validate(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new IllegalArgumentException("SQL query cannot be empty");
        }
        String normalized = sql.trim().toUpperCase(Locale.ROOT);
        if (!normalized.startsWith("SELECT") && !normalized.startsWith("SHOW")) {
            throw new IllegalArgumentException("Only SELECT and SHOW queries are allowed");
        }
        for (int i = 0; i < FORBIDDEN.size(); i++) {
            if (FORBIDDEN_WORDS.get(i).matcher(normalized).find()) {
                throw new IllegalArgumentException("SQL query contains forbidden keyword: " + FORBIDDEN.get(i));
            }
        }
    }
}
