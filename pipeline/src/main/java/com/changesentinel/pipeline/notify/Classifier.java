package com.changesentinel.pipeline.notify;

import com.changesentinel.core.model.Classification;

public interface Classifier {
    Classification classify(String title, String content);
}
