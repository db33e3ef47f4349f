package com.changesentinel.pipeline.notify;

public interface NotificationTransport {
    void deliver(String destination, String message);
}
