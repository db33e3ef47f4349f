package com.changesentinel.pipeline.detect;

import com.changesentinel.core.model.ListItem;

import java.util.List;

public record ItemDetection(Detection detection, List<ListItem> items) {
    public ItemDetection {
        items = List.copyOf(items);
    }
}
