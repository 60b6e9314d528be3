package com.ocilogs.query;

import com.ocilogs.DatasourceException;

public class RequestCancelledException extends DatasourceException {

    public RequestCancelledException(String message) {
        super(message);
    }
}
