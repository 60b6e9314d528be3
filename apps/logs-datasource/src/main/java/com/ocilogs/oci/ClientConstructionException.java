package com.ocilogs.oci;

import com.ocilogs.DatasourceException;

/**
 * Building a credential provider or one of the remote clients failed.
 */
public class ClientConstructionException extends DatasourceException {

    public ClientConstructionException(String message) {
        super(message);
    }

    public ClientConstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
