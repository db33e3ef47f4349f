package com.changesentinel.core.error;

public class HttpStatusException extends FetchException {
    private final int status;

    public HttpStatusException(String url, int status) {
        super(url, "HTTP status " + status + " from " + url);
        this.status = status;
    }

    public int status() {
        return status;
    }

    @Override
    public FetchFailure kind() {
        return FetchFailure.HTTP_STATUS;
    }

    @Override
    public boolean retryable() {
        return status >= 500;
    }
}
