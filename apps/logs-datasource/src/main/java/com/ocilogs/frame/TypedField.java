package com.ocilogs.frame;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One column of a frame: a fixed number of nullable slots sharing a value type. Two fields are
 * the same field when name and labels match.
 */
public final class TypedField {

    private final String name;
    private final ValueType valueType;
    private final SortedMap<String, String> labels;
    private final Object[] values;

    public TypedField(String name, ValueType valueType, Map<String, String> labels, int size) {
        this.name = Objects.requireNonNull(name, "name");
        this.valueType = Objects.requireNonNull(valueType, "valueType");
        this.labels = new TreeMap<>(labels == null ? Map.of() : labels);
        this.values = new Object[size];
    }

    /**
     * Name plus sorted labels. Compared by value, so label sets that render alike still differ.
     */
    public record Identity(String name, SortedMap<String, String> labels) {
        public Identity {
            labels = Collections.unmodifiableSortedMap(new TreeMap<>(labels == null ? Map.of() : labels));
        }

        @Override
        public String toString() {
            return labels.isEmpty() ? name : name + labels;
        }
    }

    public static Identity identity(String name, Map<String, String> labels) {
        return new Identity(name, labels == null ? null : new TreeMap<>(labels));
    }

    public Identity identity() {
        return identity(name, labels);
    }

    /**
     * Writes a slot, replacing what a previous record wrote there.
     */
    void set(int index, Object value) {
        values[index] = value;
    }

    @JsonProperty("name")
    public String name() {
        return name;
    }

    @JsonProperty("type")
    public ValueType valueType() {
        return valueType;
    }

    @JsonProperty("labels")
    public SortedMap<String, String> labels() {
        return Collections.unmodifiableSortedMap(labels);
    }

    @JsonProperty("values")
    public List<Object> values() {
        return Collections.unmodifiableList(Arrays.asList(values.clone()));
    }

    public Object value(int index) {
        return values[index];
    }

    public int size() {
        return values.length;
    }

    public long populated() {
        return Arrays.stream(values).filter(Objects::nonNull).count();
    }

    @Override
    public String toString() {
        return "TypedField[" + identity() + ", " + valueType + ", " + Arrays.toString(values) + "]";
    }
}
