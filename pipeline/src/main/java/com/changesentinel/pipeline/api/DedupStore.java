package com.changesentinel.pipeline.api;

import com.changesentinel.core.model.DedupEntry;

import java.util.List;

public interface DedupStore {
    boolean seen(String id);

    void mark(String id);

    List<String> seenBatch(List<String> ids);

    List<String> claim(List<String> ids);

    void reset();

    List<DedupEntry> entries();
}
