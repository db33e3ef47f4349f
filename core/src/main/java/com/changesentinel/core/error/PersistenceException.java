package com.changesentinel.core.error;

public class PersistenceException extends MonitorException {
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
