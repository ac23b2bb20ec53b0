package com.phillippitts.speaktomany.service.buffer;

/** What made a segment eligible for dispatch. */
public enum DispatchReason {
    FINAL("final"),
    HIGH_CONFIDENCE("high_confidence"),
    MAX_DELAY("max_delay");

    private final String tag;

    DispatchReason(String tag) {
        this.tag = tag;
    }

    /** Metric tag value. */
    public String tag() {
        return tag;
    }
}
