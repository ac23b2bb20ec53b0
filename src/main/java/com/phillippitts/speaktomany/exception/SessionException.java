package com.phillippitts.speaktomany.exception;

/**
 * Thrown on illegal session or agent lifecycle use, such as starting an agent twice
 * or joining a session that has already been torn down.
 */
public class SessionException extends SpeakToManyException {

    private final String sessionId;

    public SessionException(String message, String sessionId) {
        super(message + " (session: " + sessionId + ")");
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
