package com.changesentinel.pipeline.detect;

import com.changesentinel.core.model.CheckOutcome;
import com.changesentinel.core.model.Fingerprint;

public record Detection(CheckOutcome outcome, Fingerprint fingerprint, String title) {
    public String summary() {
        return fingerprint.summary();
    }
}
