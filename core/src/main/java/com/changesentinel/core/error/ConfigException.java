package com.changesentinel.core.error;

public class ConfigException extends MonitorException {
    public ConfigException(String message) {
        super(message);
    }
}
