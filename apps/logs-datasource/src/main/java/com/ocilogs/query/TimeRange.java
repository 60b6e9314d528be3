package com.ocilogs.query;

import java.time.Instant;

public record TimeRange(
        long fromEpochMs,
        long toEpochMs
) {
    public Instant from() {
        return Instant.ofEpochMilli(fromEpochMs);
    }

    public Instant to() {
        return Instant.ofEpochMilli(toEpochMs);
    }

    public long widthMs() {
        return toEpochMs - fromEpochMs;
    }
}
