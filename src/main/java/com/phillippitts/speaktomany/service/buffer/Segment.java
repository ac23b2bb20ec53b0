package com.phillippitts.speaktomany.service.buffer;

import com.phillippitts.speaktomany.domain.Language;
import com.phillippitts.speaktomany.domain.SegmentSnapshot;
import com.phillippitts.speaktomany.domain.SegmentState;
import com.phillippitts.speaktomany.domain.SegmentUpdate;
import com.phillippitts.speaktomany.util.TimeUtils;

/**
 * Mutable segment owned by {@link RealtimeTranslationBuffer}.
 *
 * <p>All state changes are serialized on the instance monitor. Updates are applied only while
 * PENDING, and {@link #beginTranslation(long)} is the single guard for at-most-once dispatch.
 */
final class Segment {

    private final String segmentId;
    private final String speakerId;
    private final Language sourceLanguage;
    private final long createdAtNanos;

    private String text;
    private boolean isFinal;
    private double confidence;
    private SegmentState state = SegmentState.PENDING;
    private long translationStartedAtNanos;
    private long translationCompletedAtNanos;

    Segment(SegmentUpdate first, long nowNanos) {
        this.segmentId = first.segmentId();
        this.speakerId = first.speakerId();
        this.sourceLanguage = first.sourceLanguage();
        this.createdAtNanos = nowNanos;
        this.text = first.text().strip();
        this.isFinal = first.isFinal();
        this.confidence = first.confidence();
    }

    String segmentId() {
        return segmentId;
    }

    String speakerId() {
        return speakerId;
    }

    Language sourceLanguage() {
        return sourceLanguage;
    }

    long createdAtNanos() {
        return createdAtNanos;
    }

    synchronized boolean merge(SegmentUpdate update) {
        if (state != SegmentState.PENDING) {
            return false;
        }
        text = update.text().strip();
        isFinal = update.isFinal();
        confidence = update.confidence();
        return true;
    }

    synchronized boolean isReadyForImmediateDispatch(double highConfidenceThreshold) {
        return state == SegmentState.PENDING
                && !text.isEmpty()
                && (isFinal || confidence > highConfidenceThreshold);
    }

    synchronized boolean isOverdue(long nowNanos, long maxDelayMs) {
        return state == SegmentState.PENDING
                && !text.isEmpty()
                && TimeUtils.millisBetween(createdAtNanos, nowNanos) > maxDelayMs;
    }

    /**
     * PENDING -> TRANSLATING. Returns false if the segment already left PENDING.
     */
    synchronized boolean beginTranslation(long nowNanos) {
        if (state != SegmentState.PENDING) {
            return false;
        }
        state = SegmentState.TRANSLATING;
        translationStartedAtNanos = nowNanos;
        return true;
    }

    synchronized void finish(boolean success, long nowNanos) {
        if (state != SegmentState.TRANSLATING) {
            throw new IllegalStateException("Segment " + segmentId + " cannot finish from " + state);
        }
        state = success ? SegmentState.COMPLETED : SegmentState.FAILED;
        translationCompletedAtNanos = nowNanos;
    }

    synchronized boolean isPending() {
        return state == SegmentState.PENDING;
    }

    synchronized boolean isExpired(long nowNanos, long graceMs) {
        return state.isTerminal() && TimeUtils.millisBetween(translationCompletedAtNanos, nowNanos) >= graceMs;
    }

    synchronized SegmentSnapshot snapshot() {
        return new SegmentSnapshot(segmentId, speakerId, text, sourceLanguage, createdAtNanos,
                isFinal, confidence, state, translationStartedAtNanos, translationCompletedAtNanos);
    }
}
