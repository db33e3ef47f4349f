package com.changesentinel.pipeline.fetch;

import java.net.URI;

@FunctionalInterface
public interface RenderedFetcher {
    String fetchRendered(URI uri);
}
