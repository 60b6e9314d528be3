package com.ocilogs.frame;

import com.fasterxml.jackson.databind.JsonNode;
import com.ocilogs.query.RawResultSet;
import com.ocilogs.query.SearchQueryShape;
import com.ocilogs.query.TimeRange;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.jboss.logging.Logger;

/**
 * Turns fetched results into frames.
 *
 * <p>Search records are spread over equal-width buckets of the requested range. Each bucket
 * holds at most one value per field: a later record landing in the same bucket overwrites the
 * earlier one. A field's type is fixed by the first value seen; later values of another shape
 * are stored as their text.
 */
@ApplicationScoped
public class ResultFramer {

    private static final Logger LOGGER = Logger.getLogger("DS.ResultFramer");

    public static final int MIN_BUCKETS = 2;
    public static final int MAX_BUCKETS = 10;
    public static final int DEFAULT_BUCKETS = 5;

    public static final String TIMESTAMP_FIELD = "timestamp";

    static final String LOG_CONTENT = "logContent";
    static final String TIME = "time";
    static final String SUBJECT = "subject";
    static final String DATA = "data";
    static final String ORACLE = "oracle";
    static final String DATETIME = "datetime";

    public DataFrame frame(String name, RawResultSet raw, TimeRange range, Integer maxDataPoints) {
        List<String> notices = new ArrayList<>();
        if (raw.pageCapReached()) {
            notices.add("listing truncated at the page cap");
        }
        if (raw.moreResultsAvailable()) {
            notices.add("more results available than returned by a single search page");
        }
        if (raw.tabular()) {
            return new DataFrame(name, table(raw.columns(), raw.rows()), notices);
        }
        SearchQueryShape shape = raw.shape() == null ? SearchQueryShape.of(null) : raw.shape();
        return new DataFrame(name, frame(raw.records(), shape, range, maxDataPoints), notices);
    }

    public List<TypedField> frame(List<JsonNode> records, TimeRange range, Integer bucketCount) {
        return frame(records, SearchQueryShape.of(null), range, bucketCount);
    }

    /**
     * Buckets the records; the first field is the {@value #TIMESTAMP_FIELD} column holding the
     * start instant of every bucket. Records outside the range are dropped; records without a
     * readable timestamp go to the last bucket.
     */
    public List<TypedField> frame(List<JsonNode> records, SearchQueryShape shape, TimeRange range, Integer bucketCount) {
        int buckets = clampBuckets(bucketCount);
        Map<TypedField.Identity, TypedField> fields = new LinkedHashMap<>();
        TypedField timestamps = new TypedField(TIMESTAMP_FIELD, ValueType.TIME, Map.of(), buckets);
        for (int i = 0; i < buckets; i++) {
            timestamps.set(i, Instant.ofEpochMilli(range.fromEpochMs() + range.widthMs() * i / buckets));
        }
        fields.put(timestamps.identity(), timestamps);

        int dropped = 0;
        for (JsonNode record : records) {
            if (record == null || !record.isObject()) {
                continue;
            }
            Optional<Instant> timestamp = timestampOf(record, shape);
            int bucket = timestamp.map(ts -> bucketIndex(ts.toEpochMilli(), range, buckets)).orElse(buckets - 1);
            if (bucket < 0) {
                dropped++;
                continue;
            }
            if (record.has(LOG_CONTENT)) {
                writeLogRecord(record.get(LOG_CONTENT), bucket, buckets, fields);
            } else {
                writeAggregateRow(record, shape, bucket, buckets, fields);
            }
        }
        if (dropped > 0) {
            LOGGER.debugv("[FRAME] {0} registros fuera del rango descartados", dropped);
        }
        return List.copyOf(fields.values());
    }

    public static int clampBuckets(Integer requested) {
        if (requested == null || requested <= 0) {
            return DEFAULT_BUCKETS;
        }
        if (requested >= MAX_BUCKETS) {
            return MAX_BUCKETS;
        }
        return Math.max(requested, MIN_BUCKETS);
    }

    /**
     * Bucket of a timestamp, or -1 when outside the range. The range end belongs to the last
     * bucket.
     */
    public static int bucketIndex(long epochMs, TimeRange range, int buckets) {
        if (epochMs < range.fromEpochMs() || epochMs > range.toEpochMs()) {
            return -1;
        }
        long width = range.widthMs();
        if (width <= 0 || epochMs == range.toEpochMs()) {
            return buckets - 1;
        }
        return (int) Math.min(buckets - 1, (epochMs - range.fromEpochMs()) * buckets / width);
    }

    private void writeLogRecord(JsonNode content, int bucket, int buckets, Map<TypedField.Identity, TypedField> fields) {
        Iterator<Map.Entry<String, JsonNode>> entries = content.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String key = entry.getKey();
            JsonNode value = entry.getValue();
            if (TIME.equals(key) || SUBJECT.equals(key) || value == null || value.isNull()) {
                continue;
            }
            if (DATA.equals(key) || ORACLE.equals(key)) {
                write(fields, key, Map.of(), buckets, bucket, value.toString(), ValueType.STRING);
                continue;
            }
            if (value.isTextual() && value.asText().isEmpty()) {
                continue;
            }
            write(fields, key, Map.of(), buckets, bucket, value);
        }
    }

    private void writeAggregateRow(JsonNode row, SearchQueryShape shape, int bucket, int buckets, Map<TypedField.Identity, TypedField> fields) {
        Map<String, JsonNode> values = new LinkedHashMap<>();
        Map<String, String> labels = new TreeMap<>();
        boolean anyValueColumn = false;
        Iterator<Map.Entry<String, JsonNode>> entries = row.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (entry.getKey().equals(shape.timestampField())) {
                continue;
            }
            if (shape.isValueColumn(entry.getKey())) {
                anyValueColumn = true;
                values.put(entry.getKey(), entry.getValue());
            }
        }

        entries = row.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String key = entry.getKey();
            JsonNode value = entry.getValue();
            if (key.equals(shape.timestampField()) || values.containsKey(key)) {
                continue;
            }
            if (!anyValueColumn && value.isNumber()) {
                values.put(key, value);
            } else {
                labels.put(key, value == null || value.isNull() ? "null" : value.isValueNode() ? value.asText() : value.toString());
            }
        }

        values.forEach((name, value) -> {
            if (value != null && !value.isNull()) {
                write(fields, name, labels, buckets, bucket, value);
            }
        });
    }

    private void write(Map<TypedField.Identity, TypedField> fields, String name, Map<String, String> labels,
                       int buckets, int bucket, JsonNode value) {
        ValueType shape = shapeOf(value);
        write(fields, name, labels, buckets, bucket, convert(value, shape), shape);
    }

    private void write(Map<TypedField.Identity, TypedField> fields, String name, Map<String, String> labels,
                       int buckets, int bucket, Object value, ValueType shape) {
        TypedField field = fields.computeIfAbsent(TypedField.identity(name, labels),
                identity -> new TypedField(name, shape, labels, buckets));
        if (field.valueType() == shape) {
            field.set(bucket, value);
        } else {
            field.set(bucket, value instanceof Instant ? value.toString() : String.valueOf(value));
        }
    }

    static ValueType shapeOf(JsonNode value) {
        if (value.isIntegralNumber()) {
            return ValueType.INT;
        }
        if (value.isNumber()) {
            return ValueType.FLOAT64;
        }
        if (value.isTextual() && parseInstant(value.asText()).isPresent()) {
            return ValueType.TIME;
        }
        return ValueType.STRING;
    }

    private static Object convert(JsonNode value, ValueType shape) {
        switch (shape) {
            case INT:
                return value.asLong();
            case FLOAT64:
                return value.asDouble();
            case TIME:
                return parseInstant(value.asText()).orElseThrow();
            case STRING:
            default:
                return value.isValueNode() ? value.asText() : value.toString();
        }
    }

    private Optional<Instant> timestampOf(JsonNode record, SearchQueryShape shape) {
        JsonNode raw = record.has(LOG_CONTENT)
                ? record.path(LOG_CONTENT).path(TIME)
                : record.path(shape.timestampField());
        if (raw.isMissingNode() || raw.isNull()) {
            raw = record.path(DATETIME);
        }
        if (raw.isNumber()) {
            return Optional.of(Instant.ofEpochMilli(raw.asLong()));
        }
        if (raw.isTextual()) {
            Optional<Instant> parsed = parseInstant(raw.asText());
            if (parsed.isEmpty()) {
                LOGGER.warnv("[FRAME] marca de tiempo ilegible: {0}", raw.asText());
            }
            return parsed;
        }
        return Optional.empty();
    }

    static Optional<Instant> parseInstant(String text) {
        if (text == null || text.length() < 10 || !Character.isDigit(text.charAt(0))) {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(text).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static List<TypedField> table(List<String> columns, List<List<String>> rows) {
        List<TypedField> fields = new ArrayList<>();
        for (int column = 0; column < columns.size(); column++) {
            TypedField field = new TypedField(columns.get(column), ValueType.STRING, Map.of(), rows.size());
            for (int row = 0; row < rows.size(); row++) {
                List<String> cells = rows.get(row);
                field.set(row, column < cells.size() ? cells.get(column) : null);
            }
            fields.add(field);
        }
        return fields;
    }
}
