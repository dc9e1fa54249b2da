package io.trading.optionchain.model;

/**
 * Single price level of one side of the order book, as delivered by the feed.
 * Both fields may be null when the feed omits them.
 *
 * @param price    Price at this level (0 is the feed's "no quote" sentinel)
 * @param quantity Quantity resting at this level
 */
public record DepthLevel(
    Double price,
    Long quantity
) {
    private static final DepthLevel EMPTY = new DepthLevel(null, null);

    /**
     * Level with neither price nor quantity.
     */
    public static DepthLevel empty() {
        return EMPTY;
    }

    /**
     * Returns true when the price is exactly zero, i.e. no quote at this level.
     */
    public boolean isNoQuote() {
        return price != null && price == 0.0;
    }
}
