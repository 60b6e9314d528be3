package com.ocilogs.query;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One query of a batch, as sent by the host.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QueryRequest(
        @JsonProperty("environment") String environment,
        @JsonProperty("tenancyMode") String tenancyMode,
        @JsonProperty("queryType") String queryType,
        @JsonProperty("region") String region,
        @JsonProperty("tenancyOCID") String tenancyOCID,
        @JsonProperty("tenancy") String tenancy,
        @JsonProperty("searchQuery") String searchQuery,
        @JsonProperty("maxDataPoints") Integer maxDataPoints,
        @JsonProperty("panelId") String panelId,
        @JsonProperty("refId") String refId,
        @JsonProperty("timeRange") TimeRange timeRange
) {
    public QueryType type() {
        return QueryType.from(queryType);
    }
}
