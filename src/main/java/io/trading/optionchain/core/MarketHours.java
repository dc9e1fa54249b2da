package io.trading.optionchain.core;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Weekday trading session in the exchange timezone.
 * Holidays are not modelled; the feed is simply quiet on those days.
 */
public class MarketHours {

    /**
     * Where a point in time falls relative to the session.
     */
    public enum Phase {
        WEEKEND,
        BEFORE_OPEN,
        IN_MARKET,
        AFTER_CLOSE
    }

    private final LocalTime open;
    private final LocalTime close;
    private final ZoneId zone;

    public MarketHours(LocalTime open, LocalTime close, ZoneId zone) {
        if (!open.isBefore(close)) {
            throw new IllegalArgumentException("open must be before close: " + open + " / " + close);
        }
        this.open = open;
        this.close = close;
        this.zone = zone;
    }

    public Phase phase(ZonedDateTime time) {
        ZonedDateTime local = time.withZoneSameInstant(zone);
        if (isWeekend(local.getDayOfWeek())) {
            return Phase.WEEKEND;
        }
        LocalTime clock = local.toLocalTime();
        if (clock.isBefore(open)) {
            return Phase.BEFORE_OPEN;
        }
        if (!clock.isBefore(close)) {
            return Phase.AFTER_CLOSE;
        }
        return Phase.IN_MARKET;
    }

    public boolean isOpen(ZonedDateTime time) {
        return phase(time) == Phase.IN_MARKET;
    }

    /**
     * Close of the session containing {@code time}, on the same exchange date.
     */
    public ZonedDateTime sessionClose(ZonedDateTime time) {
        ZonedDateTime local = time.withZoneSameInstant(zone);
        return local.toLocalDate().atTime(close).atZone(zone);
    }

    /**
     * Next session open strictly after {@code time}, or today's open when it is still ahead.
     */
    public ZonedDateTime nextOpen(ZonedDateTime time) {
        ZonedDateTime local = time.withZoneSameInstant(zone);
        ZonedDateTime candidate = local.toLocalDate().atTime(open).atZone(zone);
        if (!local.isBefore(candidate)) {
            candidate = candidate.plusDays(1);
        }
        while (isWeekend(candidate.getDayOfWeek())) {
            candidate = candidate.plusDays(1);
        }
        return candidate;
    }

    public ZoneId getZone() {
        return zone;
    }

    private static boolean isWeekend(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
