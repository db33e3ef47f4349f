package com.changesentinel.service.notify;

import com.changesentinel.pipeline.notify.NotificationTransport;

import java.util.logging.Logger;

public class LogTransport implements NotificationTransport {
    private static final Logger LOGGER = Logger.getLogger(LogTransport.class.getName());

    @Override
    public void deliver(String destination, String message) {
        LOGGER.info(() -> "[" + destination + "] " + message);
    }
}
