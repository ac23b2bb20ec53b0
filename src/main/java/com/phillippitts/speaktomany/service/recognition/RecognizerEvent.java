package com.phillippitts.speaktomany.service.recognition;

import java.util.Objects;

/**
 * Typed event emitted by a {@link SpeechRecognizer}.
 *
 * <p>The speaking participant is a required field, so downstream code never has to infer
 * who spoke.
 *
 * @param type          event kind
 * @param participantId participant whose audio produced the event
 * @param text          transcript text (transcript events only; empty otherwise)
 * @param confidence    recognizer confidence 0..1 (transcript events only)
 * @param message       diagnostic message (error events only; empty otherwise)
 */
public record RecognizerEvent(
        Type type,
        String participantId,
        String text,
        double confidence,
        String message
) {

    public enum Type { INTERIM, FINAL, DISCONNECTED, ERROR }

    public RecognizerEvent {
        Objects.requireNonNull(type, "type must not be null");
        if (participantId == null || participantId.isBlank()) {
            throw new IllegalArgumentException("participantId must not be blank");
        }
        text = text == null ? "" : text;
        message = message == null ? "" : message;
    }

    public static RecognizerEvent interim(String participantId, String text, double confidence) {
        return new RecognizerEvent(Type.INTERIM, participantId, text, confidence, null);
    }

    public static RecognizerEvent finalResult(String participantId, String text, double confidence) {
        return new RecognizerEvent(Type.FINAL, participantId, text, confidence, null);
    }

    public static RecognizerEvent disconnected(String participantId, String message) {
        return new RecognizerEvent(Type.DISCONNECTED, participantId, null, 0.0, message);
    }

    public static RecognizerEvent error(String participantId, String message) {
        return new RecognizerEvent(Type.ERROR, participantId, null, 0.0, message);
    }

    public boolean isTranscript() {
        return type == Type.INTERIM || type == Type.FINAL;
    }
}
