package com.ocilogs.query;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * What a query fetched, before framing: either search records or a listing table.
 *
 * @param pageCapReached       the listing stopped at the page cap with more pages available
 * @param moreResultsAvailable the search returned a continuation token that was not followed
 */
public record RawResultSet(
        List<JsonNode> records,
        SearchQueryShape shape,
        List<String> columns,
        List<List<String>> rows,
        boolean pageCapReached,
        boolean moreResultsAvailable
) {
    public RawResultSet {
        records = records == null ? List.of() : List.copyOf(records);
        columns = columns == null ? List.of() : List.copyOf(columns);
        rows = rows == null ? List.of() : rows.stream().map(List::copyOf).toList();
    }

    public static RawResultSet ofRecords(List<JsonNode> records, SearchQueryShape shape, boolean moreResultsAvailable) {
        return new RawResultSet(records, shape, List.of(), List.of(), false, moreResultsAvailable);
    }

    public static RawResultSet ofTable(List<String> columns, List<List<String>> rows, boolean pageCapReached) {
        return new RawResultSet(List.of(), null, columns, rows, pageCapReached, false);
    }

    public boolean tabular() {
        return !columns.isEmpty();
    }
}
