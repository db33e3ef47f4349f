package com.changesentinel.core.error;

public class FetchTimeoutException extends FetchException {
    public FetchTimeoutException(String url, Throwable cause) {
        super(url, "Request timed out while fetching " + url, cause);
    }

    @Override
    public FetchFailure kind() {
        return FetchFailure.TIMEOUT;
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
