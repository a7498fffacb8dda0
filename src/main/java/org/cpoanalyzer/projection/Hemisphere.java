package org.cpoanalyzer.projection;

import java.util.Locale;

/**
 * Hemisphere onto which the Lambert equal-area grid is projected.
 */
public enum Hemisphere {
    UPPER,
    LOWER;

    /**
     * Parses a configuration value such as {@code "upper"} or {@code "Lower"}.
     *
     * @param value the configured name.
     * @return the hemisphere.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static Hemisphere fromConfigValue(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown hemisphere '" + value + "', expected 'upper' or 'lower'", e);
        }
    }
}
