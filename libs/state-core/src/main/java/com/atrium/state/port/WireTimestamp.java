package com.atrium.state.port;

import java.time.Instant;

/**
 * The backing store's timestamp shape. Converted at the repository boundary; stores only see
 * {@link Instant}.
 */
public record WireTimestamp(long seconds, int nanos) {

    public WireTimestamp {
        if (nanos < 0 || nanos > 999_999_999) {
            throw new IllegalArgumentException("nanos must be within [0, 999999999], was " + nanos);
        }
    }

    public static WireTimestamp from(Instant instant) {
        return instant == null ? null : new WireTimestamp(instant.getEpochSecond(), instant.getNano());
    }

    public static Instant toInstant(WireTimestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    public Instant toInstant() {
        return Instant.ofEpochSecond(seconds, nanos);
    }

    public long toEpochMillis() {
        return toInstant().toEpochMilli();
    }
}
