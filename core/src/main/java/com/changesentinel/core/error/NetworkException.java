package com.changesentinel.core.error;

public class NetworkException extends FetchException {
    public NetworkException(String url, String message, Throwable cause) {
        super(url, message, cause);
    }

    @Override
    public FetchFailure kind() {
        return FetchFailure.NETWORK;
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
