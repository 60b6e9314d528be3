package com.ocilogs.oci;

import com.ocilogs.DatasourceException;

public class UnknownEnvironmentException extends DatasourceException {

    public UnknownEnvironmentException(String environment) {
        super("unknown environment type: " + environment);
    }
}
