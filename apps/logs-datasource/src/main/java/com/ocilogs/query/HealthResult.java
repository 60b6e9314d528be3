package com.ocilogs.query;

public record HealthResult(
        boolean healthy,
        String message
) {
    public static final String SUCCESS = "Success";

    public static HealthResult ok() {
        return new HealthResult(true, SUCCESS);
    }

    public static HealthResult failed(String message) {
        return new HealthResult(false, message);
    }
}
