package com.ecommercedata.scraper;

import java.util.Locale;

/**
 * Naming helpers for dataset files and table identifiers.
 *
 * @author E-commerce Data Team
 * @since 1.0
 */
public final class Utils {
    private Utils() {}

    /**
     * Sanitizes a filename by replacing each special character and whitespace with an underscore.
     * @param name Input filename
     * @return Sanitized filename
     */
    public static String sanitizeFilename(String name) {
        return name == null ? "" : name.replaceAll("[*?\"<>|/:\\\\\\s]", "_");
    }

    /**
     * Lower-cases an identifier and turns every run of whitespace or hyphens into one underscore,
     * e.g. {@code "Order Date"} becomes {@code order_date}.
     */
    public static String normalizeIdentifier(String name) {
        if (name == null) {
            return "";
        }
        return name.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s\\-]+", "_");
    }
}
