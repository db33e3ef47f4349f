package com.changesentinel.core.error;

public class NotificationException extends MonitorException {
    public NotificationException(String message) {
        super(message);
    }

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
