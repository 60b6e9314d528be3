package com.ocilogs.model;

import java.time.Instant;

public record LogSearch(
        String query,
        Instant from,
        Instant to,
        int limit,
        String pageToken
) {
}
