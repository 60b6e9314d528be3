package com.ocilogs.oci;

import com.ocilogs.DatasourceException;

/**
 * Error answered by a remote service, with its HTTP status and service code.
 */
public class RemoteServiceException extends DatasourceException {

    private final int status;
    private final String serviceCode;

    public RemoteServiceException(int status, String serviceCode, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.serviceCode = serviceCode;
    }

    public int status() {
        return status;
    }

    public String serviceCode() {
        return serviceCode;
    }
}
