package com.ocilogs.oci;

import com.ocilogs.DatasourceException;

public class UnknownTenancyException extends DatasourceException {

    private final String tenancyKey;

    public UnknownTenancyException(String tenancyKey) {
        super("Invalid tenancy key: " + tenancyKey);
        this.tenancyKey = tenancyKey;
    }

    public String tenancyKey() {
        return tenancyKey;
    }
}
