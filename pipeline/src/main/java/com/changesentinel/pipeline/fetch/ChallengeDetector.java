package com.changesentinel.pipeline.fetch;

import java.util.List;
import java.util.Optional;
import java.util.Set;

public class ChallengeDetector {
    private final Set<Integer> blockedStatuses;
    private final List<String> markers;

    public ChallengeDetector(Set<Integer> blockedStatuses, List<String> markers) {
        this.blockedStatuses = Set.copyOf(blockedStatuses);
        this.markers = List.copyOf(markers);
    }

    public static ChallengeDetector defaults() {
        return new ChallengeDetector(Set.of(403, 429), List.of("dynamic_challenge"));
    }

    public Optional<String> detect(int status, String body) {
        if (blockedStatuses.contains(status)) {
            return Optional.of("status " + status);
        }
        return markerIn(body).map(marker -> "marker '" + marker + "'");
    }

    public boolean looksBlocked(String body) {
        return markerIn(body).isPresent();
    }

    private Optional<String> markerIn(String body) {
        if (body == null) {
            return Optional.empty();
        }
        return markers.stream().filter(body::contains).findFirst();
    }
}
