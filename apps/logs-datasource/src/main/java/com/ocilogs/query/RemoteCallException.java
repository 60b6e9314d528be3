package com.ocilogs.query;

import com.ocilogs.DatasourceException;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * A single remote call (one page of a listing, or a single-shot call) failed.
 */
public class RemoteCallException extends DatasourceException {

    private final String operation;
    private final Map<String, String> parameters;

    public RemoteCallException(String operation, Map<String, String> parameters, Throwable cause) {
        super(describe(operation, sanitize(parameters), cause), cause);
        this.operation = operation;
        this.parameters = sanitize(parameters);
    }

    public String operation() {
        return operation;
    }

    public Map<String, String> parameters() {
        return parameters;
    }

    private static Map<String, String> sanitize(Map<String, String> parameters) {
        Map<String, String> copy = new TreeMap<>();
        parameters.forEach((key, value) -> copy.put(key, value == null ? "" : value));
        return Collections.unmodifiableMap(copy);
    }

    private static String describe(String operation, Map<String, String> parameters, Throwable cause) {
        String params = parameters.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(", "));
        String reason = cause == null ? "unknown error" : cause.getMessage();
        return operation + " failed [" + params + "]: " + reason;
    }
}
