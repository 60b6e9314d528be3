package com.ocilogs.query;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SearchQueryShapeTest {

    @Test
    void plainSearchReturnsLogRecords() {
        SearchQueryShape shape = SearchQueryShape.of("search \"ocid1.compartment.oc1..x\" | sort by datetime desc");

        assertEquals(SearchQueryShape.Kind.LOG_RECORDS, shape.kind());
        assertFalse(shape.aggregation());
    }

    @Test
    void countOverWholeRangeIsAMetric() {
        assertEquals(SearchQueryShape.Kind.METRICS, SearchQueryShape.of("search \"x\" | count").kind());
        assertEquals(SearchQueryShape.Kind.METRICS,
                SearchQueryShape.of("search \"x\" | summarize count() by source").kind());
    }

    @Test
    void rounddownAliasNamesTheTimestampColumn() {
        SearchQueryShape shape = SearchQueryShape.of(
                "search \"x\" | summarize avg(latency) as lat by rounddown(datetime, '5m') as interval");

        assertEquals(SearchQueryShape.Kind.METRICS_TIME_SERIES, shape.kind());
        assertEquals("interval", shape.timestampField());
        assertEquals("lat", shape.valueField().orElseThrow());
        assertTrue(shape.isValueColumn("lat"));
        assertFalse(shape.isValueColumn("source"));
    }

    @Test
    void withoutAliasCountAndFunctionColumnsAreValues() {
        SearchQueryShape shape = SearchQueryShape.of("search \"x\" | summarize sum(bytes) by rounddown(datetime, '1m')");

        assertEquals(SearchQueryShape.DEFAULT_TIMESTAMP_FIELD, shape.timestampField());
        assertTrue(shape.isValueColumn("count"));
        assertTrue(shape.isValueColumn("sum(bytes)"));
        assertFalse(shape.isValueColumn("host"));
    }
}
