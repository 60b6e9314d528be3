package com.ocilogs.model;

public record OciResource(
        String name,
        String ocid
) {
}
