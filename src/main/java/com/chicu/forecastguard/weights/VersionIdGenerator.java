package com.chicu.forecastguard.weights;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Версии вида v20261019_120000_123. Монотонны в пределах процесса:
 * два вызова в одну миллисекунду дают разные версии.
 */
public class VersionIdGenerator {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneOffset.UTC);

    private final Clock clock;
    private final AtomicLong lastMillis = new AtomicLong(Long.MIN_VALUE);

    public VersionIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public Instant nextInstant() {
        long now = clock.millis();
        long ms = lastMillis.updateAndGet(prev -> Math.max(prev + 1, now));
        return Instant.ofEpochMilli(ms);
    }

    public static String format(Instant at) {
        return "v" + FORMAT.format(at);
    }
}
