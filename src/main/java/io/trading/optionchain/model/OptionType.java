package io.trading.optionchain.model;

/**
 * Option right as listed by the exchange.
 */
public enum OptionType {
    CE("C"),
    PE("P");

    private final String shortCode;

    OptionType(String shortCode) {
        this.shortCode = shortCode;
    }

    /**
     * One-letter code written to the option_type column.
     */
    public String getShortCode() {
        return shortCode;
    }

    /**
     * Parses an exchange instrument type ("CE"/"PE", case-insensitive).
     */
    public static OptionType fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("option type cannot be null");
        }
        return switch (code.trim().toUpperCase()) {
            case "CE", "C", "CALL" -> CE;
            case "PE", "P", "PUT" -> PE;
            default -> throw new IllegalArgumentException("Unknown option type: " + code);
        };
    }
}
