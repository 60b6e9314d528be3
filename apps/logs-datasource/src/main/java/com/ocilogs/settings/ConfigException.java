package com.ocilogs.settings;

import com.ocilogs.DatasourceException;

/**
 * La configuración del datasource no tiene la forma esperada.
 */
public class ConfigException extends DatasourceException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
