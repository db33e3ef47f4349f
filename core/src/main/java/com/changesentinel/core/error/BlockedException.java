package com.changesentinel.core.error;

public class BlockedException extends FetchException {
    public BlockedException(String url, String detail) {
        super(url, "Blocked by anti-automation challenge at " + url + ": " + detail);
    }

    public BlockedException(String url, String detail, Throwable cause) {
        super(url, "Blocked by anti-automation challenge at " + url + ": " + detail, cause);
    }

    @Override
    public FetchFailure kind() {
        return FetchFailure.BLOCKED;
    }

    @Override
    public boolean retryable() {
        return false;
    }
}
