package io.trading.optionchain.upstream;

import java.util.Locale;

/**
 * How expiries are picked from the catalog for each underlying.
 */
public enum ExpiryMode {
    /** Only the nearest expiry. */
    NEAREST,
    /** The first few upcoming expiries. */
    WEEKLY,
    /** One expiry per month, late in the month. */
    MONTHLY,
    /** Expiries listed in configuration. */
    EXPLICIT_LIST;

    /**
     * Parses a configuration value such as "nearest" or "explicit_list".
     */
    public static ExpiryMode fromName(String name) {
        if (name == null || name.isBlank()) {
            return NEAREST;
        }
        return ExpiryMode.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
