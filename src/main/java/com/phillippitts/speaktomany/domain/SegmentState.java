package com.phillippitts.speaktomany.domain;

/**
 * Lifecycle of a transcript segment. Transitions are strictly
 * {@code PENDING -> TRANSLATING -> (COMPLETED | FAILED)}, each at most once.
 */
public enum SegmentState {
    PENDING,
    TRANSLATING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
