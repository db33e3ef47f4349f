package com.changesentinel.core.error;

public class ContentParseException extends MonitorException {
    public ContentParseException(String message) {
        super(message);
    }

    public ContentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
