package com.phillippitts.speaktomany.service.recognition;

import com.phillippitts.speaktomany.domain.Language;

import java.util.function.Consumer;

/**
 * One streaming speech-to-text connection for a single participant audio track.
 *
 * <p>Implementations wrap a concrete provider and are supplied by the deployment through a
 * {@link RecognizerFactory}.
 */
public interface SpeechRecognizer extends AutoCloseable {

    String participantId();

    Language language();

    /**
     * Opens the stream and begins emitting events to {@code sink}.
     *
     * @throws com.phillippitts.speaktomany.exception.RecognitionException if the stream cannot be opened
     */
    void start(Consumer<RecognizerEvent> sink);

    /**
     * Closes and reopens the stream, keeping the sink passed to {@link #start(Consumer)}.
     *
     * @throws com.phillippitts.speaktomany.exception.RecognitionException if the stream cannot be reopened
     */
    void restart();

    boolean isHealthy();

    @Override
    void close();
}
