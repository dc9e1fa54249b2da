package io.trading.optionchain.model;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Static descriptor of one option contract in the universe.
 *
 * @param token         Instrument token on the feed
 * @param tradingSymbol Exchange trading symbol (e.g., "NIFTY25JAN24000CE")
 * @param underlying    Underlying symbol (e.g., "NIFTY")
 * @param expiryDate    Expiry date
 * @param strike        Strike price
 * @param optionType    CE or PE
 * @param instrumentId  Deterministic id, see {@link #instrumentIdFor}
 * @param lotSize       Contract lot size
 */
public record ContractMeta(
    long token,
    String tradingSymbol,
    String underlying,
    LocalDate expiryDate,
    double strike,
    OptionType optionType,
    String instrumentId,
    int lotSize
) {
    private static final DateTimeFormatter BASIC_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    public ContractMeta {
        if (token <= 0) {
            throw new IllegalArgumentException("token must be positive: " + token);
        }
        if (underlying == null || underlying.isEmpty()) {
            throw new IllegalArgumentException("underlying cannot be null or empty");
        }
        if (expiryDate == null) {
            throw new IllegalArgumentException("expiryDate cannot be null");
        }
        if (optionType == null) {
            throw new IllegalArgumentException("optionType cannot be null");
        }
        if (tradingSymbol == null) {
            tradingSymbol = "";
        }
        if (instrumentId == null || instrumentId.isEmpty()) {
            instrumentId = instrumentIdFor(underlying, expiryDate, strike, optionType);
        }
    }

    /**
     * Builds the instrument id: {UNDERLYING}_{EXPIRYYYYYMMDD}_{STRIKE}{CE|PE}.
     * The strike is truncated to an integer.
     */
    public static String instrumentIdFor(String underlying, LocalDate expiry, double strike, OptionType type) {
        return underlying + "_" + expiry.format(BASIC_DATE) + "_" + (long) strike + type.name();
    }
}
