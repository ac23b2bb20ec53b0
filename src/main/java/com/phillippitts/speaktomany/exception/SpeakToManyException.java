package com.phillippitts.speaktomany.exception;

/**
 * Base exception for all speakToMany application-specific errors.
 * All domain exceptions extend this class so callers can handle them uniformly.
 */
public class SpeakToManyException extends RuntimeException {

    public SpeakToManyException(String message) {
        super(message);
    }

    public SpeakToManyException(String message, Throwable cause) {
        super(message, cause);
    }

    public SpeakToManyException(Throwable cause) {
        super(cause);
    }
}
