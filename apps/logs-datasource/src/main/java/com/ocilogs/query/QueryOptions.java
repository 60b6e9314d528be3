package com.ocilogs.query;

import java.time.Duration;

public record QueryOptions(
        Duration refreshInterval,
        int searchPageLimit,
        int compartmentMaxPages,
        Duration healthWindow
) {
    public static QueryOptions defaults() {
        return new QueryOptions(Duration.ofMinutes(1), 500, 20, Duration.ofMinutes(30));
    }
}
