package com.ocilogs.model;

public record CompartmentSummary(
        String id,
        String name,
        String parentId,
        boolean active
) {
}
