package com.ocilogs.datasource;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Values for a template variable: the distinct values of {@code field} returned by
 * {@code getquery}. Times are epoch milliseconds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FieldValuesRequest(
        String tenancy,
        String region,
        String getquery,
        String field,
        Long timeStart,
        Long timeEnd
) {
}
