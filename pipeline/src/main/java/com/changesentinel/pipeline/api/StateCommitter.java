package com.changesentinel.pipeline.api;

@FunctionalInterface
public interface StateCommitter {
    void commit();
}
