package com.warden.core.confirmation;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Generates unique, time-ordered confirmation request ids such as {@code CR-20261018T143012.123-000042}.
 * Ids sort lexicographically in creation order even if the wall clock steps backwards.
 */
class RequestIdGenerator {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss.SSS").withZone(ZoneOffset.UTC);

    private final Clock clock;
    private long lastMillis;
    private long sequence;

    RequestIdGenerator() {
        this(Clock.systemUTC());
    }

    RequestIdGenerator(Clock clock) {
        this.clock = clock;
    }

    synchronized String next() {
        lastMillis = Math.max(lastMillis, clock.millis());
        sequence = (sequence + 1) % 1_000_000;
        return "CR-" + FORMAT.format(Instant.ofEpochMilli(lastMillis)) + "-" + String.format("%06d", sequence);
    }
}
