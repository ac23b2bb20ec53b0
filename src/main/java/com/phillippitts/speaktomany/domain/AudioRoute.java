package com.phillippitts.speaktomany.domain;

import java.util.Locale;
import java.util.Objects;

/**
 * Directed audio edge from a source participant to a target listener.
 *
 * <p>Routes are derived wholesale from participant configs; only {@code active}
 * varies independently (pause/resume).
 */
public record AudioRoute(
        String sourceId,
        String targetId,
        Language sourceLanguage,
        Language targetLanguage,
        StreamType streamType,
        boolean active
) {

    public AudioRoute {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
        Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
        Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");
        Objects.requireNonNull(streamType, "streamType must not be null");
        if (sourceId.equals(targetId)) {
            throw new IllegalArgumentException("A route cannot loop back to its source: " + sourceId);
        }
    }

    /** Stable identifier, e.g. {@code alice_to_bob_translated}. */
    public String routeId() {
        return routeId(sourceId, targetId, streamType);
    }

    public static String routeId(String sourceId, String targetId, StreamType streamType) {
        return sourceId + "_to_" + targetId + "_" + streamType.name().toLowerCase(Locale.ROOT);
    }

    public AudioRoute withActive(boolean value) {
        return value == active ? this : new AudioRoute(sourceId, targetId, sourceLanguage, targetLanguage, streamType, value);
    }
}
