package com.phillippitts.speaktomany.domain;

import java.util.Objects;

/**
 * Immutable view of a segment handed to dispatch listeners.
 *
 * <p>Timestamps are {@link System#nanoTime()} values; {@code translationStartedAtNanos} is 0
 * while the segment is pending and {@code translationCompletedAtNanos} is 0 until it reaches
 * a terminal state.
 */
public record SegmentSnapshot(
        String segmentId,
        String speakerId,
        String text,
        Language sourceLanguage,
        long createdAtNanos,
        boolean isFinal,
        double confidence,
        SegmentState state,
        long translationStartedAtNanos,
        long translationCompletedAtNanos
) {

    public SegmentSnapshot {
        Objects.requireNonNull(segmentId, "segmentId must not be null");
        Objects.requireNonNull(speakerId, "speakerId must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
        Objects.requireNonNull(state, "state must not be null");
    }

    /** Milliseconds since the segment was first submitted. */
    public long ageMillis() {
        return (System.nanoTime() - createdAtNanos) / 1_000_000L;
    }
}
