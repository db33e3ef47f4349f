package com.changesentinel.pipeline.fetch;

import java.net.URI;
import java.time.Duration;

@FunctionalInterface
public interface RawFetcher {
    String fetchRaw(URI uri, Duration timeout);
}
