package com.ffibind.generator.util;

/**
 * Utility for consistent naming conventions in synthesized identifiers.
 */
public class NamingUtil {

    public static final String WORD_SEPARATOR = "_";

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts PascalCase, camelCase, kebab-case or QStyleNames to snake_case.
     * Examples: QString -> q_string, HTTPServer -> http_server, MyType2 -> my_type2.
     */
    public static String toSnakeCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        // Acronym followed by a capitalized word
        String result = name.replaceAll("([A-Z]+)([A-Z][a-z])", "$1_$2");
        // Handle camelCase or PascalCase
        result = result.replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        // Handle hyphens, spaces and path separators
        result = result.replaceAll("[-\\s:]+", "_");
        result = result.replaceAll("_+", "_");
        return result.toLowerCase();
    }

    /**
     * Appends a numeric disambiguation suffix: {@code item} + 3 -> {@code item_3}.
     */
    public static String withNumericSuffix(String baseName, int number) {
        return baseName + WORD_SEPARATOR + number;
    }
}
