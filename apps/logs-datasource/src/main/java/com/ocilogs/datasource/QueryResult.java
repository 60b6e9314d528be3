package com.ocilogs.datasource;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ocilogs.frame.DataFrame;

/**
 * Outcome of one query of a batch: a frame, or the error that stopped it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryResult(
        String refId,
        DataFrame frame,
        String error
) {
    public static QueryResult success(String refId, DataFrame frame) {
        return new QueryResult(refId, frame, null);
    }

    public static QueryResult failure(String refId, String error) {
        return new QueryResult(refId, null, error);
    }

    public boolean failed() {
        return error != null;
    }
}
