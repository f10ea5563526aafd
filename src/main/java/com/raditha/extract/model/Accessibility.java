package com.raditha.extract.model;

/**
 * Access modifier given to the generated method.
 */
public enum Accessibility {
    PRIVATE("private"),
    PACKAGE_PRIVATE(""),
    PROTECTED("protected"),
    PUBLIC("public");

    private final String keyword;

    Accessibility(String keyword) {
        this.keyword = keyword;
    }

    /**
     * The modifier keyword, empty for package-private.
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Parse a configuration value such as "private" or "package_private".
     */
    public static Accessibility fromString(String value) {
        String normalized = value.trim().toUpperCase().replace('-', '_');
        if (normalized.equals("PACKAGE") || normalized.equals("DEFAULT")) {
            return PACKAGE_PRIVATE;
        }
        return valueOf(normalized);
    }
}
