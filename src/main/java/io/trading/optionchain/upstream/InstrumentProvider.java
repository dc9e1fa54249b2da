package io.trading.optionchain.upstream;

import io.trading.optionchain.model.ContractMeta;

import java.util.List;
import java.util.Map;

/**
 * Source of the option universe and seed spot prices.
 * Which contracts are selected is decided behind this interface.
 */
public interface InstrumentProvider {

    /**
     * Returns the contracts to record for the given underlyings, keyed by token.
     * Iteration order of the returned map is the output row order.
     */
    Map<Long, ContractMeta> universe(List<String> underlyings);

    /**
     * Returns the latest known spot price per underlying. Missing underlyings are simply absent.
     */
    Map<String, Double> spotPrices(List<String> underlyings);
}
