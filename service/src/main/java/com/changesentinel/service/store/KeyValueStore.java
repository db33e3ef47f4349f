package com.changesentinel.service.store;

import java.util.Optional;

public interface KeyValueStore {
    Optional<byte[]> get(String key);

    void put(String key, byte[] value);

    void delete(String key);
}
