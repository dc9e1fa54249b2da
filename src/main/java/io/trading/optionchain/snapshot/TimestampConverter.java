package io.trading.optionchain.snapshot;

import io.trading.optionchain.model.Tick;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;

/**
 * Converts exchange timestamps to UTC epoch microseconds.
 * Timezone-naive timestamps are read in the exchange zone; the result is truncated, never rounded.
 */
public class TimestampConverter {

    private final ZoneId zone;
    private final Clock clock;

    public TimestampConverter(ZoneId zone) {
        this(zone, Clock.system(zone));
    }

    public TimestampConverter(ZoneId zone, Clock clock) {
        this.zone = zone;
        this.clock = clock;
    }

    public long toEpochMicros(LocalDateTime exchangeTime) {
        return toEpochMicros(exchangeTime.atZone(zone).toInstant());
    }

    public static long toEpochMicros(Instant instant) {
        return ChronoUnit.MICROS.between(Instant.EPOCH, instant);
    }

    /**
     * Wall clock now, in epoch microseconds.
     */
    public long nowMicros() {
        return toEpochMicros(clock.instant());
    }

    /**
     * The tick's exchange timestamp when present, otherwise wall clock now.
     */
    public long tickMicros(Tick tick) {
        if (tick != null && tick.exchangeTimestamp() != null) {
            return toEpochMicros(tick.exchangeTimestamp());
        }
        return nowMicros();
    }

    public ZoneId getZone() {
        return zone;
    }
}
