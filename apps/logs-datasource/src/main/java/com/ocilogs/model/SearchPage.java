package com.ocilogs.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

public record SearchPage(
        List<JsonNode> results,
        String nextPage,
        int status
) {
    public SearchPage {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public boolean hasNextPage() {
        return nextPage != null && !nextPage.isEmpty();
    }
}
