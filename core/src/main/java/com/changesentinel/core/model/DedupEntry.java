package com.changesentinel.core.model;

import java.time.Instant;

public record DedupEntry(String id, Instant firstSeen) {
}
