package com.phillippitts.speaktomany.service.session;

import com.phillippitts.speaktomany.domain.Language;
import com.phillippitts.speaktomany.domain.TranslationPreferences;
import com.phillippitts.speaktomany.domain.TranslationResult;

/**
 * What a session needs from a per-user agent.
 */
public interface SessionParticipant {

    String participantId();

    Language language();

    TranslationPreferences preferences();

    /**
     * Hands a finished translation to this participant's playback path.
     */
    void deliver(TranslationResult result);

    /**
     * Whether this participant's agent has {@code speakerId} registered as a remote participant.
     */
    boolean hasRemote(String speakerId);

    /**
     * Asks this agent to start recognizing {@code speakerId} after the previous owner left.
     */
    void takeOverRecognition(String speakerId);
}
