package io.trading.optionchain.snapshot;

import io.trading.optionchain.model.ContractMeta;
import io.trading.optionchain.model.DepthLevel;
import io.trading.optionchain.model.SnapshotRow;
import io.trading.optionchain.model.Tick;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns the latest ticks and contract metadata into option chain rows.
 *
 * <p>Depth rules: up to {@value #DEPTH_LEVELS} levels per side, a missing level is
 * (null, null) and a level priced exactly 0 is (null, null) whatever its quantity.
 * Mid and spread are set only when both best bid and best ask exist.
 *
 * <p>Stateless apart from counters; safe to call from several threads.
 */
public class SnapshotBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(SnapshotBuilder.class);

    public static final int DEPTH_LEVELS = 3;

    private final String venueLabel;
    private final TimestampConverter timestamps;

    private final AtomicLong malformedTicks = new AtomicLong(0);
    private final AtomicLong skippedContracts = new AtomicLong(0);

    public SnapshotBuilder(String venueLabel, TimestampConverter timestamps) {
        this.venueLabel = venueLabel;
        this.timestamps = timestamps;
    }

    /**
     * Builds one row.
     *
     * @param tick     Latest tick, or null for a metadata-only row
     * @param meta     Contract metadata
     * @param spots    Spot lookup; a missing spot leaves underlying_spot null
     * @param tsMicros Row timestamp, or null to take it from the tick (or wall clock)
     * @throws TransformException if the tick carries a malformed depth level
     */
    public SnapshotRow buildRow(Tick tick, ContractMeta meta, SpotPriceLookup spots, Long tsMicros) {
        if (meta == null) {
            throw new TransformException(tick == null ? 0 : tick.token(), "no contract metadata");
        }
        long ts = tsMicros != null ? tsMicros : timestamps.tickMicros(tick);

        DepthLevel[] bids = extractDepth(meta.token(), tick == null ? List.of() : tick.buyDepth());
        DepthLevel[] asks = extractDepth(meta.token(), tick == null ? List.of() : tick.sellDepth());

        Double bestBidPx = bids[0].price();
        Double bestAskPx = asks[0].price();
        Double midPx = null;
        Double spread = null;
        if (bestBidPx != null && bestAskPx != null) {
            midPx = (bestBidPx + bestAskPx) / 2;
            spread = bestAskPx - bestBidPx;
        }

        return new SnapshotRow(
            ts,
            venueLabel,
            meta.underlying(),
            spots == null ? null : spots.spotFor(meta.underlying()),
            meta.instrumentId(),
            meta.tradingSymbol(),
            meta.expiryDate(),
            meta.strike(),
            meta.optionType().getShortCode(),
            bestBidPx,
            bids[0].quantity(),
            bestAskPx,
            asks[0].quantity(),
            midPx,
            spread,
            tick == null ? null : tick.lastPrice(),
            tick == null ? null : tick.lastQuantity(),
            bids[0].price(),
            bids[0].quantity(),
            bids[1].price(),
            bids[1].quantity(),
            bids[2].price(),
            bids[2].quantity(),
            asks[0].price(),
            asks[0].quantity(),
            asks[1].price(),
            asks[1].quantity(),
            asks[2].price(),
            asks[2].quantity()
        );
    }

    /**
     * Builds one row per universe entry, in universe iteration order.
     * Tokens without a tick get metadata-only rows. A malformed tick falls back to the
     * metadata-only row for its token; a missing metadata entry is skipped.
     *
     * @param ticks    Latest tick per token
     * @param universe Contract metadata per token
     * @param spots    Spot lookup
     * @param tsMicros Timestamp shared by every row, or null for wall clock now
     */
    public List<SnapshotRow> buildSnapshot(
        Map<Long, Tick> ticks,
        Map<Long, ContractMeta> universe,
        SpotPriceLookup spots,
        Long tsMicros
    ) {
        long ts = tsMicros != null ? tsMicros : timestamps.nowMicros();
        List<SnapshotRow> rows = new ArrayList<>(universe.size());

        for (Map.Entry<Long, ContractMeta> entry : universe.entrySet()) {
            ContractMeta meta = entry.getValue();
            if (meta == null) {
                skippedContracts.incrementAndGet();
                LOGGER.warn("No metadata for token {}, row skipped", entry.getKey());
                continue;
            }
            Tick tick = ticks.get(entry.getKey());
            try {
                rows.add(buildRow(tick, meta, spots, ts));
            } catch (TransformException e) {
                malformedTicks.incrementAndGet();
                LOGGER.warn("Malformed tick, writing metadata-only row: {}", e.getMessage());
                rows.add(buildRow(null, meta, spots, ts));
            }
        }
        return rows;
    }

    private static DepthLevel[] extractDepth(long token, List<DepthLevel> side) {
        DepthLevel[] levels = new DepthLevel[DEPTH_LEVELS];
        for (int i = 0; i < DEPTH_LEVELS; i++) {
            if (i >= side.size()) {
                levels[i] = DepthLevel.empty();
                continue;
            }
            DepthLevel level = side.get(i);
            if (level == null) {
                throw new TransformException(token, "depth level " + i + " is null");
            }
            if (level.isNoQuote()) {
                levels[i] = DepthLevel.empty();
                continue;
            }
            if (level.price() != null && (level.price() < 0 || level.price().isNaN())) {
                throw new TransformException(token, "invalid price " + level.price() + " at level " + i);
            }
            if (level.quantity() != null && level.quantity() < 0) {
                throw new TransformException(token, "negative quantity " + level.quantity() + " at level " + i);
            }
            levels[i] = level;
        }
        return levels;
    }

    public long getMalformedTicks() {
        return malformedTicks.get();
    }

    public long getSkippedContracts() {
        return skippedContracts.get();
    }
}
