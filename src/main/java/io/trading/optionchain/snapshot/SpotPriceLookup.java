package io.trading.optionchain.snapshot;

import java.util.Map;

/**
 * Spot price per underlying symbol.
 */
@FunctionalInterface
public interface SpotPriceLookup {

    /**
     * @return The spot price, or null when unknown
     */
    Double spotFor(String underlying);

    static SpotPriceLookup of(Map<String, Double> spots) {
        Map<String, Double> copy = Map.copyOf(spots);
        return copy::get;
    }

    static SpotPriceLookup none() {
        return underlying -> null;
    }
}
