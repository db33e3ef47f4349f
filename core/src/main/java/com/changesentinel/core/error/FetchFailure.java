package com.changesentinel.core.error;

public enum FetchFailure {
    TIMEOUT,
    NETWORK,
    HTTP_STATUS,
    BLOCKED
}
