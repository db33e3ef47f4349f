package com.changesentinel.core.error;

public abstract class FetchException extends MonitorException {
    private final String url;

    protected FetchException(String url, String message) {
        super(message);
        this.url = url;
    }

    protected FetchException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String url() {
        return url;
    }

    public abstract FetchFailure kind();

    public abstract boolean retryable();
}
