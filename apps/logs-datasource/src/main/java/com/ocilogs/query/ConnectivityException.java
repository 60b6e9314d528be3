package com.ocilogs.query;

import com.ocilogs.DatasourceException;

/**
 * Health check or transport failure. Carries the remote status and body for diagnosis.
 */
public class ConnectivityException extends DatasourceException {

    private final int status;
    private final String body;

    public ConnectivityException(String message, int status, String body) {
        super(message);
        this.status = status;
        this.body = body;
    }

    public ConnectivityException(String message, int status, String body, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.body = body;
    }

    public int status() {
        return status;
    }

    public String body() {
        return body;
    }
}
