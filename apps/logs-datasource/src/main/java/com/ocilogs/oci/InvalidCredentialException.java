package com.ocilogs.oci;

import com.ocilogs.DatasourceException;

/**
 * The private key of a profile is not a parsable PEM block.
 */
public class InvalidCredentialException extends DatasourceException {

    private final String profileKey;

    public InvalidCredentialException(String profileKey, String message) {
        super(message);
        this.profileKey = profileKey;
    }

    public InvalidCredentialException(String profileKey, String message, Throwable cause) {
        super(message, cause);
        this.profileKey = profileKey;
    }

    public String profileKey() {
        return profileKey;
    }
}
