package io.trading.optionchain.model;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

/**
 * One normalized option chain row, produced once per contract per sampling cycle.
 * Values stay typed; rendering to text happens in the persistence layer.
 */
public record SnapshotRow(
    long ts,
    String venue,
    String underlyingSymbol,
    Double underlyingSpot,
    String instrumentId,
    String optionSymbol,
    LocalDate expiryDate,
    Double strike,
    String optionType,
    Double bestBidPx,
    Long bestBidSz,
    Double bestAskPx,
    Long bestAskSz,
    Double midPx,
    Double spread,
    Double lastTradePx,
    Long lastTradeSz,
    Double bidPx1,
    Long bidSz1,
    Double bidPx2,
    Long bidSz2,
    Double bidPx3,
    Long bidSz3,
    Double askPx1,
    Long askSz1,
    Double askPx2,
    Long askSz2,
    Double askPx3,
    Long askSz3
) {
    /**
     * Output columns, in file order.
     */
    public static final List<String> COLUMNS = List.of(
        "ts",
        "venue",
        "underlying_symbol",
        "underlying_spot",
        "instrument_id",
        "option_symbol",
        "expiry_date",
        "strike",
        "option_type",
        "best_bid_px",
        "best_bid_sz",
        "best_ask_px",
        "best_ask_sz",
        "mid_px",
        "spread",
        "last_trade_px",
        "last_trade_sz",
        "bid_px_1",
        "bid_sz_1",
        "bid_px_2",
        "bid_sz_2",
        "bid_px_3",
        "bid_sz_3",
        "ask_px_1",
        "ask_sz_1",
        "ask_px_2",
        "ask_sz_2",
        "ask_px_3",
        "ask_sz_3"
    );

    /**
     * Returns the field values in {@link #COLUMNS} order. Nulls are preserved.
     */
    public List<Object> values() {
        return Arrays.asList(
            ts,
            venue,
            underlyingSymbol,
            underlyingSpot,
            instrumentId,
            optionSymbol,
            expiryDate,
            strike,
            optionType,
            bestBidPx,
            bestBidSz,
            bestAskPx,
            bestAskSz,
            midPx,
            spread,
            lastTradePx,
            lastTradeSz,
            bidPx1,
            bidSz1,
            bidPx2,
            bidSz2,
            bidPx3,
            bidSz3,
            askPx1,
            askSz1,
            askPx2,
            askSz2,
            askPx3,
            askSz3
        );
    }
}
