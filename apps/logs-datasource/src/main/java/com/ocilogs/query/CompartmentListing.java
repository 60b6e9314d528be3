package com.ocilogs.query;

import com.ocilogs.model.OciResource;
import java.util.List;

/**
 * Active compartments of a tenancy, root entry first, as cached between requests.
 */
public record CompartmentListing(
        List<OciResource> compartments,
        boolean pageCapReached
) {
    public CompartmentListing {
        compartments = List.copyOf(compartments);
    }

    long cost() {
        return compartments.stream()
                .mapToLong(entry -> 32L + length(entry.name()) + length(entry.ocid()))
                .sum();
    }

    private static int length(String value) {
        return value == null ? 0 : value.length();
    }
}
