package com.phillippitts.speaktomany.service.buffer;

import java.time.Instant;

/**
 * Published when every listener raised for a dispatched segment. The segment is discarded,
 * never retried.
 *
 * <p>PII note: carries ids only, never transcript text.
 */
public record SegmentFailedEvent(
        String sessionId,
        String segmentId,
        String speakerId,
        int failedListeners,
        Instant at
) {
    public SegmentFailedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
