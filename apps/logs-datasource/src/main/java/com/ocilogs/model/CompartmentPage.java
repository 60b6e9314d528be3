package com.ocilogs.model;

import java.util.List;

public record CompartmentPage(
        List<CompartmentSummary> items,
        String nextPage
) {
    public CompartmentPage {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public boolean hasNextPage() {
        return nextPage != null && !nextPage.isEmpty();
    }
}
