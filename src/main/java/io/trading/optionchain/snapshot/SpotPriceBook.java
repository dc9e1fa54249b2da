package io.trading.optionchain.snapshot;

import io.trading.optionchain.model.Tick;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mutable spot price book shared by the sampler and the row builder.
 * Seeded once from the instrument provider, then refreshed from the index ticks.
 */
public class SpotPriceBook implements SpotPriceLookup {

    private static final Logger LOGGER = LoggerFactory.getLogger(SpotPriceBook.class);

    private final Map<String, Double> spots = new ConcurrentHashMap<>();

    @Override
    public Double spotFor(String underlying) {
        if (underlying == null) {
            return null;
        }
        return spots.get(underlying.toUpperCase(Locale.ROOT));
    }

    public void update(String underlying, double spot) {
        if (!(spot > 0) || Double.isInfinite(spot)) {
            LOGGER.debug("Ignoring spot {} for {}", spot, underlying);
            return;
        }
        spots.put(underlying.toUpperCase(Locale.ROOT), spot);
    }

    public void updateAll(Map<String, Double> prices) {
        prices.forEach((underlying, spot) -> {
            if (spot != null) {
                update(underlying, spot);
            }
        });
    }

    /**
     * Refreshes spots from the latest index ticks.
     *
     * @param ticks      Latest tick per token
     * @param spotTokens Index token per underlying
     * @return Number of underlyings updated
     */
    public int refreshFromTicks(Map<Long, Tick> ticks, Map<String, Long> spotTokens) {
        int updated = 0;
        for (Map.Entry<String, Long> entry : spotTokens.entrySet()) {
            Tick tick = ticks.get(entry.getValue());
            if (tick != null && tick.lastPrice() != null && tick.lastPrice() > 0) {
                update(entry.getKey(), tick.lastPrice());
                updated++;
            }
        }
        return updated;
    }

    public Map<String, Double> snapshot() {
        return new HashMap<>(spots);
    }
}
