package com.phillippitts.speaktomany.service.recognition;

import com.phillippitts.speaktomany.config.properties.RecognitionProperties;
import com.phillippitts.speaktomany.domain.Language;
import com.phillippitts.speaktomany.domain.SegmentUpdate;
import com.phillippitts.speaktomany.service.buffer.TranslationBuffer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import java.util.regex.Pattern;

/**
 * Normalizes one speaker's recognizer events into {@link SegmentUpdate}s for the translation buffer.
 *
 * <p><b>Segment ids:</b> one id per utterance. A new id is issued after a final result, after a
 * silence gap longer than {@code recognition.silence-gap-ms}, and after a recognizer error.
 *
 * <p><b>Forced dispatch:</b> if the buffer already dispatched the current segment (max delay
 * reached while the speaker kept talking), the rest of the utterance continues under a new id and
 * the text already dispatched is stripped from the recognizer's cumulative transcript.
 *
 * <p><b>Errors:</b> a disconnect or error event drops the partial segment and publishes a
 * {@link RecognizerFailureEvent}; the next transcript event starts a fresh segment. Malformed
 * events are dropped with a warning.
 *
 * <p>This class does no translation and no routing. Events are serialized on an internal lock.
 */
public final class StreamingTranscriptAdapter implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(StreamingTranscriptAdapter.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]");

    private final String sessionId;
    private final String speakerId;
    private final Language language;
    private final SpeechRecognizer recognizer;
    private final TranslationBuffer buffer;
    private final RecognitionProperties props;
    private final ApplicationEventPublisher publisher;
    private final LongSupplier nanoClock;

    private final Lock lock = new ReentrantLock();
    private final AtomicBoolean open = new AtomicBoolean(false);
    private String currentSegmentId;
    private String committedPrefix = "";
    private String lastAcceptedText = "";
    private long lastEventNanos;

    private final AtomicLong segmentsStarted = new AtomicLong();
    private final AtomicLong updatesForwarded = new AtomicLong();
    private final AtomicLong updatesDropped = new AtomicLong();

    public StreamingTranscriptAdapter(String sessionId,
                                      SpeechRecognizer recognizer,
                                      TranslationBuffer buffer,
                                      RecognitionProperties props,
                                      ApplicationEventPublisher publisher) {
        this(sessionId, recognizer, buffer, props, publisher, System::nanoTime);
    }

    StreamingTranscriptAdapter(String sessionId,
                               SpeechRecognizer recognizer,
                               TranslationBuffer buffer,
                               RecognitionProperties props,
                               ApplicationEventPublisher publisher,
                               LongSupplier nanoClock) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.recognizer = Objects.requireNonNull(recognizer, "recognizer");
        this.speakerId = Objects.requireNonNull(recognizer.participantId(), "recognizer.participantId");
        this.language = Objects.requireNonNull(recognizer.language(), "recognizer.language");
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    /** Key identifying this recognizer stream to the watchdog. */
    public String key() {
        return sessionId + "/" + speakerId;
    }

    public String speakerId() {
        return speakerId;
    }

    public Language language() {
        return language;
    }

    public SpeechRecognizer recognizer() {
        return recognizer;
    }

    public void start() {
        if (!open.compareAndSet(false, true)) {
            return;
        }
        try {
            recognizer.start(this::onEvent);
        } catch (RuntimeException e) {
            open.set(false);
            throw e;
        }
        LOG.info("Recognition started: speaker={}, locale={}", speakerId, language.recognizerLocale());
    }

    /**
     * Entry point for recognizer events.
     */
    public void onEvent(RecognizerEvent event) {
        if (!open.get() || event == null) {
            return;
        }
        if (!speakerId.equals(event.participantId())) {
            LOG.warn("Dropping recognizer event for {} on stream of {}", event.participantId(), speakerId);
            updatesDropped.incrementAndGet();
            return;
        }
        switch (event.type()) {
            case INTERIM -> onInterim(event.text(), event.confidence());
            case FINAL -> onFinal(event.text(), event.confidence());
            case DISCONNECTED, ERROR -> onRecognizerFailure(event);
        }
    }

    /**
     * Interim result. Forwarded only when interim results are enabled and the confidence is
     * above {@code recognition.confidence-threshold}.
     */
    public void onInterim(String text, double confidence) {
        if (!props.isEnableInterimResults()) {
            return;
        }
        if (!isWellFormed(text, confidence)) {
            return;
        }
        if (confidence <= props.getConfidenceThreshold()) {
            updatesDropped.incrementAndGet();
            return;
        }
        forward(text, confidence, false);
    }

    /** Final result for the current utterance. Always forwarded. */
    public void onFinal(String text, double confidence) {
        if (!isWellFormed(text, confidence)) {
            return;
        }
        forward(text, confidence, true);
    }

    private void onRecognizerFailure(RecognizerEvent event) {
        lock.lock();
        try {
            if (currentSegmentId != null) {
                LOG.debug("Dropping partial segment {} after recognizer {}", currentSegmentId, event.type());
            }
            resetUtterance();
        } finally {
            lock.unlock();
        }
        LOG.warn("Recognizer {} for speaker {}: {}", event.type(), speakerId, event.message());
        publisher.publishEvent(new RecognizerFailureEvent(key(), speakerId, Instant.now(), event.message(),
                Map.of("type", event.type().name(), "locale", language.recognizerLocale())));
    }

    private boolean isWellFormed(String text, double confidence) {
        if (text == null || Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            LOG.warn("Dropping malformed recognizer event for speaker {}: confidence={}", speakerId, confidence);
            updatesDropped.incrementAndGet();
            return false;
        }
        return true;
    }

    private void forward(String text, double confidence, boolean isFinal) {
        lock.lock();
        try {
            long now = nanoClock.getAsLong();
            if (currentSegmentId != null && silenceGapExceeded(now)) {
                LOG.debug("Silence gap on speaker {}; closing segment {}", speakerId, currentSegmentId);
                continueUnderNewSegment();
            }
            lastEventNanos = now;
            if (currentSegmentId == null) {
                beginSegment();
            }

            String payload = stripCommitted(text);
            if (!payload.isEmpty()) {
                boolean accepted = submit(payload, confidence, isFinal);
                if (!accepted && buffer.isRunning()) {
                    // Already dispatched by the max-delay sweep
                    continueUnderNewSegment();
                    payload = stripCommitted(text);
                    if (!payload.isEmpty()) {
                        submit(payload, confidence, isFinal);
                    }
                }
            }

            if (isFinal) {
                resetUtterance();
            }
        } finally {
            lock.unlock();
        }
    }

    private boolean submit(String payload, double confidence, boolean isFinal) {
        SegmentUpdate update = new SegmentUpdate(currentSegmentId, speakerId, payload, language, isFinal, confidence);
        if (buffer.submit(update)) {
            lastAcceptedText = payload;
            updatesForwarded.incrementAndGet();
            return true;
        }
        updatesDropped.incrementAndGet();
        return false;
    }

    private boolean silenceGapExceeded(long nowNanos) {
        long gapMs = props.getSilenceGapMs();
        return gapMs > 0 && TimeUnit.NANOSECONDS.toMillis(nowNanos - lastEventNanos) > gapMs;
    }

    private void beginSegment() {
        currentSegmentId = speakerId + "-" + UUID.randomUUID();
        segmentsStarted.incrementAndGet();
    }

    /** Commits the text accepted so far and moves the rest of the utterance to a new id. */
    private void continueUnderNewSegment() {
        if (!lastAcceptedText.isEmpty()) {
            committedPrefix = committedPrefix.isEmpty() ? lastAcceptedText : committedPrefix + " " + lastAcceptedText;
        }
        lastAcceptedText = "";
        beginSegment();
    }

    private void resetUtterance() {
        currentSegmentId = null;
        committedPrefix = "";
        lastAcceptedText = "";
    }

    /**
     * Recognizers report the whole utterance so far; drop the part already dispatched. Words are
     * compared ignoring case and punctuation. If an earlier word changed, the whole text is kept.
     */
    String stripCommitted(String text) {
        String t = text.strip();
        if (committedPrefix.isEmpty() || t.isEmpty()) {
            return t;
        }
        String[] committed = WHITESPACE.split(committedPrefix);
        String[] words = WHITESPACE.split(t);
        if (words.length < committed.length) {
            return t;
        }
        for (int i = 0; i < committed.length; i++) {
            if (!normalizeWord(committed[i]).equals(normalizeWord(words[i]))) {
                LOG.debug("Recognizer rewrote dispatched text for speaker {}; resending utterance", speakerId);
                return t;
            }
        }
        return String.join(" ", Arrays.copyOfRange(words, committed.length, words.length));
    }

    private static String normalizeWord(String word) {
        return NON_WORD.matcher(word).replaceAll("").toLowerCase(Locale.ROOT);
    }

    String currentSegmentId() {
        lock.lock();
        try {
            return currentSegmentId;
        } finally {
            lock.unlock();
        }
    }

    public long segmentsStarted() {
        return segmentsStarted.get();
    }

    public long updatesForwarded() {
        return updatesForwarded.get();
    }

    public long updatesDropped() {
        return updatesDropped.get();
    }

    public boolean isOpen() {
        return open.get();
    }

    @Override
    public void close() {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        lock.lock();
        try {
            resetUtterance();
        } finally {
            lock.unlock();
        }
        try {
            recognizer.close();
        } catch (RuntimeException e) {
            LOG.warn("Error closing recognizer for speaker {}: {}", speakerId, e.toString());
        }
        LOG.info("Recognition stopped: speaker={}", speakerId);
    }
}
