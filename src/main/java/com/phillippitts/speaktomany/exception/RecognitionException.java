package com.phillippitts.speaktomany.exception;

/**
 * Thrown when a speech recognizer stream cannot be opened or restarted.
 * Recognition failures are never fatal to a session; the watchdog decides whether to retry.
 */
public class RecognitionException extends SpeakToManyException {

    private final String participantId;

    public RecognitionException(String message, String participantId) {
        super(message + " (participant: " + participantId + ")");
        this.participantId = participantId;
    }

    public RecognitionException(String message, String participantId, Throwable cause) {
        super(message + " (participant: " + participantId + ")", cause);
        this.participantId = participantId;
    }

    public String getParticipantId() {
        return participantId;
    }
}
