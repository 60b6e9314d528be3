package com.ocilogs.query;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * What a log search query returns, read from the query text: raw log records, aggregated rows
 * over the whole range, or aggregated rows per {@code rounddown} interval.
 */
public record SearchQueryShape(
        Kind kind,
        String timestampField,
        Optional<String> valueField
) {
    public enum Kind {
        LOG_RECORDS,
        METRICS,
        METRICS_TIME_SERIES
    }

    public static final String DEFAULT_TIMESTAMP_FIELD = "datetime";

    private static final Pattern MATH_FUNCTION = Pattern.compile("(avg|sum|min|max)\\s*\\(.+\\)");
    private static final Pattern COUNT_FUNCTION = Pattern.compile("\\s*count\\s*\\(.*\\)");
    private static final Pattern TRAILING_COUNT = Pattern.compile("\\|\\s*count\\s*$");
    private static final Pattern ROUNDDOWN = Pattern.compile("rounddown\\s*\\(.+\\)");
    private static final Pattern ROUNDDOWN_ALIAS = Pattern.compile("rounddown\\s*\\([^)]+\\)\\s+as\\s+(?<alias>[^,\\s]+)");
    private static final Pattern FUNCTION_ALIAS = Pattern.compile("(count|sum|avg|min|max)\\s*\\([^)]*\\)\\s+as\\s+(?<alias>[^\\s,]+)");

    public static SearchQueryShape of(String query) {
        String text = query == null ? "" : query;
        boolean aggregation = MATH_FUNCTION.matcher(text).find()
                || COUNT_FUNCTION.matcher(text).find()
                || TRAILING_COUNT.matcher(text).find();
        if (!aggregation) {
            return new SearchQueryShape(Kind.LOG_RECORDS, DEFAULT_TIMESTAMP_FIELD, Optional.empty());
        }
        Optional<String> valueField = alias(FUNCTION_ALIAS, text);
        if (ROUNDDOWN.matcher(text).find()) {
            return new SearchQueryShape(Kind.METRICS_TIME_SERIES,
                    alias(ROUNDDOWN_ALIAS, text).orElse(DEFAULT_TIMESTAMP_FIELD), valueField);
        }
        return new SearchQueryShape(Kind.METRICS, DEFAULT_TIMESTAMP_FIELD, valueField);
    }

    public boolean aggregation() {
        return kind != Kind.LOG_RECORDS;
    }

    /**
     * Whether a result column holds the aggregated value rather than a dimension.
     */
    public boolean isValueColumn(String column) {
        if (valueField.isPresent()) {
            return valueField.get().equals(column);
        }
        return "count".equals(column) || MATH_FUNCTION.matcher(column).find() || COUNT_FUNCTION.matcher(column).matches();
    }

    private static Optional<String> alias(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? Optional.of(stripQuotes(matcher.group("alias"))) : Optional.empty();
    }

    private static String stripQuotes(String alias) {
        if (alias.length() >= 2 && (alias.startsWith("'") && alias.endsWith("'")
                || alias.startsWith("\"") && alias.endsWith("\""))) {
            return alias.substring(1, alias.length() - 1);
        }
        return alias;
    }
}
