package com.changesentinel.core.model;

import java.util.Objects;

public record Fingerprint(String digest, String summary) {
    public Fingerprint {
        Objects.requireNonNull(digest, "digest is required");
    }

    public boolean sameContentAs(Fingerprint other) {
        return other != null && digest.equals(other.digest());
    }
}
