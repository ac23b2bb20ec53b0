package com.phillippitts.speaktomany.domain;

import java.util.Objects;

/**
 * Proposed change to a transcript segment, produced by the streaming transcript adapter.
 *
 * <p>The buffer owns the segment itself; an update only takes effect while the segment
 * is still pending.
 *
 * @param segmentId      stable id of the utterance this update belongs to
 * @param speakerId      participant who spoke; always populated
 * @param text           transcript text so far (may be blank for recognizer noise)
 * @param sourceLanguage language of {@code text}
 * @param isFinal        whether the recognizer marked this utterance as finished
 * @param confidence     recognizer confidence between 0.0 and 1.0
 */
public record SegmentUpdate(
        String segmentId,
        String speakerId,
        String text,
        Language sourceLanguage,
        boolean isFinal,
        double confidence
) {

    public SegmentUpdate {
        if (segmentId == null || segmentId.isBlank()) {
            throw new IllegalArgumentException("segmentId must not be blank");
        }
        if (speakerId == null || speakerId.isBlank()) {
            throw new IllegalArgumentException("speakerId must not be blank");
        }
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }
}
