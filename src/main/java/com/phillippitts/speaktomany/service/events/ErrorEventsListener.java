package com.phillippitts.speaktomany.service.events;

import com.phillippitts.speaktomany.service.buffer.SegmentFailedEvent;
import com.phillippitts.speaktomany.service.recognition.RecognizerFailureEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized operator-facing summary of failure events. Throttled per stream and per session to
 * avoid log spam; never logs transcript text.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onRecognizerFailure(RecognizerFailureEvent e) {
        String key = "recognizer-" + e.recognizerKey();
        if (shouldLog(key)) {
            LOG.warn("Speech recognition interrupted for participant {} ({}). Their speech is not "
                    + "translated until the stream recovers.", e.participantId(), e.context().getOrDefault("type", "ERROR"));
        }
    }

    @EventListener
    void onSegmentFailed(SegmentFailedEvent e) {
        String key = "segment-failed-" + e.sessionId();
        if (shouldLog(key)) {
            LOG.warn("Translation failed for every listener in session {} (segment {}, speaker {}). "
                    + "Check translation.service.* settings and provider status.",
                    e.sessionId(), e.segmentId(), e.speakerId());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
