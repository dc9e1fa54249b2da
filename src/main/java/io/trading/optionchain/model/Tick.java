package io.trading.optionchain.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Latest market data update for one instrument.
 * A newer tick for the same token replaces the previous one entirely.
 *
 * @param token             Instrument token (required)
 * @param lastPrice         Last traded price
 * @param lastQuantity      Last traded quantity
 * @param exchangeTimestamp Exchange timestamp, timezone-naive (exchange local time)
 * @param buyDepth          Bid side levels, best first (at most 5 from the feed)
 * @param sellDepth         Ask side levels, best first (at most 5 from the feed)
 */
public record Tick(
    long token,
    Double lastPrice,
    Long lastQuantity,
    LocalDateTime exchangeTimestamp,
    List<DepthLevel> buyDepth,
    List<DepthLevel> sellDepth
) {
    public Tick {
        if (token <= 0) {
            throw new IllegalArgumentException("token must be positive: " + token);
        }
        // null entries are kept so a malformed level is visible to the row builder
        buyDepth = buyDepth == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(buyDepth));
        sellDepth = sellDepth == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(sellDepth));
    }

    /**
     * Creates a tick without depth or exchange timestamp.
     */
    public static Tick lastTradeOnly(long token, Double lastPrice, Long lastQuantity) {
        return new Tick(token, lastPrice, lastQuantity, null, List.of(), List.of());
    }
}
