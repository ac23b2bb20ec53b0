package com.phillippitts.speaktomany.service.recognition;

import java.time.Instant;

/**
 * Published when a recognizer stream has been restarted after a failure.
 */
public record RecognizerRecoveredEvent(
        String recognizerKey,
        Instant at
) {
    public RecognizerRecoveredEvent {
        if (at == null) at = Instant.now();
    }
}
