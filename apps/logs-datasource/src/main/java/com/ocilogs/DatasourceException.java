package com.ocilogs;

/**
 * Excepción base para errores del datasource de logs.
 */
public class DatasourceException extends RuntimeException {

    public DatasourceException(String message) {
        super(message);
    }

    public DatasourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
