package com.ocilogs.datasource;

import com.ocilogs.DatasourceException;

public class UnknownDatasourceException extends DatasourceException {

    public UnknownDatasourceException(String uid) {
        super("datasource not configured: " + uid);
    }
}
