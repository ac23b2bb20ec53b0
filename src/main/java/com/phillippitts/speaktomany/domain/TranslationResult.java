package com.phillippitts.speaktomany.domain;

import java.util.Objects;

/**
 * Immutable result of translating one segment for one listener.
 *
 * <p>Created once per listener per segment and consumed once by that listener's playback path.
 *
 * @param segmentId            segment this translation belongs to
 * @param speakerId            participant who spoke the original text
 * @param listenerId           participant this translation is addressed to
 * @param originalText         source text as dispatched
 * @param translatedText       provider output
 * @param sourceLanguage       language of {@code originalText}
 * @param targetLanguage       language of {@code translatedText}
 * @param translationLatencyMs time spent in the translation call
 * @param totalLatencyMs       time from first submission of the segment to this result
 */
public record TranslationResult(
        String segmentId,
        String speakerId,
        String listenerId,
        String originalText,
        String translatedText,
        Language sourceLanguage,
        Language targetLanguage,
        long translationLatencyMs,
        long totalLatencyMs
) {

    public TranslationResult {
        Objects.requireNonNull(segmentId, "segmentId must not be null");
        Objects.requireNonNull(speakerId, "speakerId must not be null");
        Objects.requireNonNull(listenerId, "listenerId must not be null");
        Objects.requireNonNull(originalText, "originalText must not be null");
        Objects.requireNonNull(translatedText, "translatedText must not be null");
        Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
        Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");
        if (translationLatencyMs < 0 || totalLatencyMs < 0) {
            throw new IllegalArgumentException("Latencies must not be negative");
        }
    }
}
