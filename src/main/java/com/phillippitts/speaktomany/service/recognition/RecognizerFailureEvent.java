package com.phillippitts.speaktomany.service.recognition;

import java.time.Instant;
import java.util.Map;

/**
 * Published when a recognizer stream disconnects or reports an error.
 *
 * <p>PII note: Do not include transcript text in context. Restrict to technical diagnostics.
 */
public record RecognizerFailureEvent(
        String recognizerKey,
        String participantId,
        Instant at,
        String message,
        Map<String, String> context
) {
    public RecognizerFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
